package daddy.model.hom;

import daddy.model.ddd.Edge;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The rest of an assignment whose target edge has already been removed: it keeps consuming edges into the sum,
 * buffering them as pending, and once the sum is resolved it emits the target edge and hoists it above the
 * pending edges with an {@link UpHom}.
 */
public final class DownHom extends Hom {

	private final String target;
	private final WeightedSum sum;
	private final List<Edge> pending;

	public DownHom(String target, WeightedSum sum, List<Edge> pending) {
		this.target = target;
		this.sum = sum;
		this.pending = Collections.unmodifiableList(new ArrayList<>(pending));
	}

	public String getTarget() {
		return target;
	}

	public WeightedSum getSum() {
		return sum;
	}

	public List<Edge> getPending() {
		return pending;
	}

	@Override
	public <T, E extends Throwable> T accept(HomVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(target, sum, pending);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		DownHom other = (DownHom) obj;
		return target.equals(other.target) && sum.equals(other.sum) && pending.equals(other.pending);
	}

}
