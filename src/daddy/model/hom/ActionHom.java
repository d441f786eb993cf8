package daddy.model.hom;

import java.util.Objects;

/**
 * Applies a whole {@link Action} in one walk down the path. Variables missing from the effect keep their value;
 * every variable the effect names must appear on the path.
 */
public final class ActionHom extends Hom {

	private final Action action;

	public ActionHom(Action action) {
		this.action = action;
	}

	public Action getAction() {
		return action;
	}

	@Override
	public <T, E extends Throwable> T accept(HomVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(action);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		return action.equals(((ActionHom) obj).action);
	}

}
