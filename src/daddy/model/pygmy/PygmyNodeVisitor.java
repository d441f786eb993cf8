package daddy.model.pygmy;

public abstract class PygmyNodeVisitor<T, E extends Throwable> {
	public abstract T visit(PygmyExpression expression) throws E;
	public abstract T visit(PygmyStatement statement) throws E;
	public abstract T visit(PygmyDeclaration declaration) throws E;
	public abstract T visit(PygmyGlobal global) throws E;
	public abstract T visit(PygmyUnit unit) throws E;
	public abstract T visit(PygmyVar var) throws E;
	public abstract T visit(PygmyStruct struct) throws E;
	public abstract T visit(PygmyFunc func) throws E;
	public abstract T visit(PygmyModule module) throws E;
}
