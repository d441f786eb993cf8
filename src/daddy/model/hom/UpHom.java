package daddy.model.hom;

import daddy.model.ddd.Edge;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Re-inserts buffered edges right below the first edge of the diagram it is applied to, which moves that first
 * edge up above all of them.
 */
public final class UpHom extends Hom {

	private final List<Edge> buffered;

	public UpHom(List<Edge> buffered) {
		this.buffered = Collections.unmodifiableList(new ArrayList<>(buffered));
	}

	public List<Edge> getBuffered() {
		return buffered;
	}

	@Override
	public <T, E extends Throwable> T accept(HomVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(buffered);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		return buffered.equals(((UpHom) obj).buffered);
	}

}
