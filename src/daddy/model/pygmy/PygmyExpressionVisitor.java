package daddy.model.pygmy;

public abstract class PygmyExpressionVisitor<T, E extends Throwable> {
	public abstract T visit(PygmyConst pygmyConst) throws E;
	public abstract T visit(PygmyName pygmyName) throws E;
	public abstract T visit(PygmyAttr pygmyAttr) throws E;
	public abstract T visit(PygmyItem pygmyItem) throws E;
	public abstract T visit(PygmyOp pygmyOp) throws E;
	public abstract T visit(PygmyCall pygmyCall) throws E;
	public abstract T visit(PygmySequence pygmySequence) throws E;
}
