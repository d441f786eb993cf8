package daddy.trans.passes.linear;

import daddy.model.ddd.VariableOrder;
import daddy.model.hom.Comparator;
import daddy.model.hom.Condition;

import java.util.Objects;

/**
 * {@code form op 0}, before being bound to a variable order.
 */
public final class LinearCondition {

	private final LinearForm form;
	private final Comparator comparator;

	public LinearCondition(LinearForm form, Comparator comparator) {
		this.form = form;
		this.comparator = comparator;
	}

	public LinearForm getForm() {
		return form;
	}

	public Comparator getComparator() {
		return comparator;
	}

	public Condition toCondition(VariableOrder order) {
		return new Condition(form.toWeightedSum(order), comparator);
	}

	@Override
	public int hashCode() {
		return Objects.hash(form, comparator);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		LinearCondition other = (LinearCondition) obj;
		return comparator == other.comparator && form.equals(other.form);
	}

	@Override
	public String toString() {
		return form + " " + comparator.getSymbol() + " 0";
	}

}
