package daddy.model.pygmy;

import daddy.util.SourceLocation;

/**
 * A top-level declaration as written in the source, before names are resolved.
 */
public abstract class PygmyDeclaration extends PygmyNode {

	public PygmyDeclaration(SourceLocation location) {
		super(location);
	}

	@Override
	public <T, E extends Throwable> T accept(PygmyNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	public abstract <T, E extends Throwable> T accept(PygmyDeclarationVisitor<T, E> v) throws E;

}
