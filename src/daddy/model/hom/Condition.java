package daddy.model.hom;

import daddy.InternalCompilerError;

import java.util.Objects;

/**
 * {@code sum op 0}, decided once every variable of the sum has been consumed.
 */
public final class Condition {

	private final WeightedSum sum;
	private final Comparator comparator;

	public Condition(WeightedSum sum, Comparator comparator) {
		this.sum = sum;
		this.comparator = comparator;
	}

	public WeightedSum getSum() {
		return sum;
	}

	public Comparator getComparator() {
		return comparator;
	}

	public boolean isDone() {
		return sum.isDone();
	}

	public Condition feed(String variable, int value) {
		WeightedSum fed = sum.feed(variable, value);
		return fed == sum ? this : new Condition(fed, comparator);
	}

	public boolean holds() {
		if (!isDone()) {
			throw new InternalCompilerError("evaluation of unresolved condition " + this);
		}
		return comparator.test(sum.value());
	}

	public Condition negate() {
		return new Condition(sum, comparator.negate());
	}

	@Override
	public int hashCode() {
		return Objects.hash(sum, comparator);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		Condition other = (Condition) obj;
		return comparator == other.comparator && sum.equals(other.sum);
	}

	@Override
	public String toString() {
		return sum + " " + comparator.getSymbol() + " 0";
	}

}
