package daddy.model.hom;

public abstract class HomVisitor<T, E extends Throwable> {
	public abstract T visit(IdentityHom identityHom) throws E;
	public abstract T visit(ConstHom constHom) throws E;
	public abstract T visit(AssignHom assignHom) throws E;
	public abstract T visit(DownHom downHom) throws E;
	public abstract T visit(UpHom upHom) throws E;
	public abstract T visit(ActionHom actionHom) throws E;
	public abstract T visit(ComposeHom composeHom) throws E;
}
