package daddy.model.hom;

import java.util.Objects;

/**
 * Sets one variable to a fixed value, or adds the value to it when augmenting.
 */
public final class ConstHom extends Hom {

	private final String variable;
	private final int value;
	private final boolean augment;

	public ConstHom(String variable, int value, boolean augment) {
		this.variable = variable;
		this.value = value;
		this.augment = augment;
	}

	public String getVariable() {
		return variable;
	}

	public int getValue() {
		return value;
	}

	public boolean isAugment() {
		return augment;
	}

	@Override
	public <T, E extends Throwable> T accept(HomVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(variable, value, augment);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ConstHom other = (ConstHom) obj;
		return value == other.value && augment == other.augment && variable.equals(other.variable);
	}

}
