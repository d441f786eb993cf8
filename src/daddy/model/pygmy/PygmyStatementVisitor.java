package daddy.model.pygmy;

public abstract class PygmyStatementVisitor<T, E extends Throwable> {
	public abstract T visit(PygmyPass pygmyPass) throws E;
	public abstract T visit(PygmyAssign pygmyAssign) throws E;
	public abstract T visit(PygmyIf pygmyIf) throws E;
	public abstract T visit(PygmyFor pygmyFor) throws E;
	public abstract T visit(PygmyReturn pygmyReturn) throws E;
	public abstract T visit(PygmyBareCall pygmyBareCall) throws E;
}
