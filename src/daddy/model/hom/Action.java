package daddy.model.hom;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One guarded transition: when every condition of the guard holds, each variable of the effect takes the value
 * of its sum, all sums being evaluated on the state before the transition.
 */
public final class Action {

	private final List<Condition> guard;
	private final Map<String, WeightedSum> effect;

	public Action(List<Condition> guard, Map<String, WeightedSum> effect) {
		this.guard = Collections.unmodifiableList(new ArrayList<>(guard));
		this.effect = Collections.unmodifiableMap(new LinkedHashMap<>(effect));
	}

	public List<Condition> getGuard() {
		return guard;
	}

	public Map<String, WeightedSum> getEffect() {
		return effect;
	}

	@Override
	public int hashCode() {
		return Objects.hash(guard, effect);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		Action other = (Action) obj;
		return guard.equals(other.guard) && effect.equals(other.effect);
	}

	@Override
	public String toString() {
		return guard + " -> " + effect;
	}

}
