package daddy.model.hom;

public final class IdentityHom extends Hom {

	public static final IdentityHom INSTANCE = new IdentityHom();

	private IdentityHom() {}

	@Override
	public <T, E extends Throwable> T accept(HomVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return IdentityHom.class.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof IdentityHom;
	}

}
