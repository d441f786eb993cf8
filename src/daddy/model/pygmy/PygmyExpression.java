package daddy.model.pygmy;

import daddy.util.SourceLocation;

public abstract class PygmyExpression extends PygmyNode {

	public PygmyExpression(SourceLocation location) {
		super(location);
	}

	@Override
	public <T, E extends Throwable> T accept(PygmyNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	public abstract <T, E extends Throwable> T accept(PygmyExpressionVisitor<T, E> v) throws E;

}
