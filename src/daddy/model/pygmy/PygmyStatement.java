package daddy.model.pygmy;

import daddy.util.SourceLocation;

public abstract class PygmyStatement extends PygmyNode {
	public PygmyStatement(SourceLocation location) {
		super(location);
	}

	@Override
	public <T, E extends Throwable> T accept(PygmyNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	public abstract <T, E extends Throwable> T accept(PygmyStatementVisitor<T, E> v) throws E;
}
