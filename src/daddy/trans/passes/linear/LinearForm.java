package daddy.trans.passes.linear;

import daddy.model.ddd.VariableOrder;
import daddy.model.hom.WeightedSum;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * An integer linear combination of variables plus a constant. Arithmetic overflows throw
 * {@link ArithmeticException}.
 */
public final class LinearForm {

	private static final LinearForm ZERO = new LinearForm(Collections.emptyMap(), 0);

	// sorted by name, no zero coefficients
	private final Map<String, Integer> coefficients;
	private final int constant;

	private LinearForm(Map<String, Integer> coefficients, int constant) {
		this.coefficients = coefficients;
		this.constant = constant;
	}

	public static LinearForm of(Map<String, Integer> coefficients, int constant) {
		Map<String, Integer> terms = new TreeMap<>();
		for (Map.Entry<String, Integer> term : coefficients.entrySet()) {
			if (term.getValue() != 0) {
				terms.put(term.getKey(), term.getValue());
			}
		}
		return new LinearForm(Collections.unmodifiableMap(terms), constant);
	}

	public static LinearForm constant(int constant) {
		return constant == 0 ? ZERO : new LinearForm(Collections.emptyMap(), constant);
	}

	public static LinearForm variable(String variable) {
		return new LinearForm(Collections.singletonMap(variable, 1), 0);
	}

	public Map<String, Integer> getCoefficients() {
		return coefficients;
	}

	public int getCoefficient(String variable) {
		return coefficients.getOrDefault(variable, 0);
	}

	public int getConstant() {
		return constant;
	}

	public boolean isConstant() {
		return coefficients.isEmpty();
	}

	public LinearForm plus(LinearForm other) {
		Map<String, Integer> terms = new TreeMap<>(coefficients);
		for (Map.Entry<String, Integer> term : other.coefficients.entrySet()) {
			terms.merge(term.getKey(), term.getValue(), Math::addExact);
		}
		return of(terms, Math.addExact(constant, other.constant));
	}

	public LinearForm scale(int factor) {
		Map<String, Integer> terms = new TreeMap<>();
		for (Map.Entry<String, Integer> term : coefficients.entrySet()) {
			terms.put(term.getKey(), Math.multiplyExact(term.getValue(), factor));
		}
		return of(terms, Math.multiplyExact(constant, factor));
	}

	public LinearForm negate() {
		return scale(-1);
	}

	public LinearForm minus(LinearForm other) {
		return plus(other.negate());
	}

	public WeightedSum toWeightedSum(VariableOrder order) {
		return WeightedSum.of(order, coefficients, constant);
	}

	@Override
	public int hashCode() {
		return Objects.hash(coefficients, constant);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		LinearForm other = (LinearForm) obj;
		return constant == other.constant && coefficients.equals(other.coefficients);
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (Map.Entry<String, Integer> term : coefficients.entrySet()) {
			if (builder.length() > 0) {
				builder.append(" + ");
			}
			builder.append(term.getValue()).append("*").append(term.getKey());
		}
		if (builder.length() == 0 || constant != 0) {
			if (builder.length() > 0) {
				builder.append(" + ");
			}
			builder.append(constant);
		}
		return builder.toString();
	}

}
