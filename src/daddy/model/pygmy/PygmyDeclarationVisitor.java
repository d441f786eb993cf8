package daddy.model.pygmy;

public abstract class PygmyDeclarationVisitor<T, E extends Throwable> {
	public abstract T visit(PygmyStaticBinding pygmyStaticBinding) throws E;
	public abstract T visit(PygmyImport pygmyImport) throws E;
	public abstract T visit(PygmyVarDeclaration pygmyVarDeclaration) throws E;
	public abstract T visit(PygmyStructDeclaration pygmyStructDeclaration) throws E;
	public abstract T visit(PygmyFuncDeclaration pygmyFuncDeclaration) throws E;
}
