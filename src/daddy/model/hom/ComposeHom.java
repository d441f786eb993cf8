package daddy.model.hom;

import java.util.Objects;

/**
 * {@code outer * inner}: applies inner, then outer to its result.
 */
public final class ComposeHom extends Hom {

	private final Hom outer;
	private final Hom inner;

	public ComposeHom(Hom outer, Hom inner) {
		this.outer = outer;
		this.inner = inner;
	}

	public Hom getOuter() {
		return outer;
	}

	public Hom getInner() {
		return inner;
	}

	@Override
	public <T, E extends Throwable> T accept(HomVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(outer, inner);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ComposeHom other = (ComposeHom) obj;
		return outer.equals(other.outer) && inner.equals(other.inner);
	}

}
