package daddy.model.hom;

import java.util.Objects;

/**
 * {@code target := sum}, the sum being evaluated on the incoming path. When the target comes before the last
 * variable of the sum, its edge is dropped and re-emitted later, see {@link DownHom}.
 */
public final class AssignHom extends Hom {

	private final String target;
	private final WeightedSum sum;

	public AssignHom(String target, WeightedSum sum) {
		this.target = target;
		this.sum = sum;
	}

	public String getTarget() {
		return target;
	}

	public WeightedSum getSum() {
		return sum;
	}

	@Override
	public <T, E extends Throwable> T accept(HomVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(target, sum);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		AssignHom other = (AssignHom) obj;
		return target.equals(other.target) && sum.equals(other.sum);
	}

}
