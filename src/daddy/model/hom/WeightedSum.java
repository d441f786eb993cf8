package daddy.model.hom;

import daddy.InternalCompilerError;
import daddy.model.ddd.VariableOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A linear combination of state variables plus a constant, consumed one variable at a time in the variable order
 * while a path is walked. Instances are immutable: consuming a variable yields a new sum whose constant has
 * absorbed that variable's contribution.
 */
public final class WeightedSum {

	// remaining terms, sorted by the variable order, no zero coefficients
	private final List<String> variables;
	private final List<Integer> coefficients;
	private final int constant;

	private WeightedSum(List<String> variables, List<Integer> coefficients, int constant) {
		this.variables = variables;
		this.coefficients = coefficients;
		this.constant = constant;
	}

	public static WeightedSum of(VariableOrder order, Map<String, Integer> coefficients, int constant) {
		List<String> sorted = new ArrayList<>();
		for (Map.Entry<String, Integer> term : coefficients.entrySet()) {
			if (!order.contains(term.getKey())) {
				throw new InternalCompilerError("'" + term.getKey() + "' is not a state variable");
			}
			if (term.getValue() != 0) {
				sorted.add(term.getKey());
			}
		}
		sorted.sort((a, b) -> Integer.compare(order.indexOf(a), order.indexOf(b)));
		List<Integer> coefs = new ArrayList<>();
		for (String variable : sorted) {
			coefs.add(coefficients.get(variable));
		}
		return new WeightedSum(Collections.unmodifiableList(sorted), Collections.unmodifiableList(coefs), constant);
	}

	public static WeightedSum constant(int constant) {
		return new WeightedSum(Collections.emptyList(), Collections.emptyList(), constant);
	}

	/**
	 * @return the sum holding just the current value of the variable
	 */
	public static WeightedSum identity(String variable) {
		return new WeightedSum(Collections.singletonList(variable), Collections.singletonList(1), 0);
	}

	public boolean isDone() {
		return variables.isEmpty();
	}

	public String nextVariable() {
		if (isDone()) {
			throw new InternalCompilerError("no variable left in " + this);
		}
		return variables.get(0);
	}

	public boolean mentions(String variable) {
		return variables.contains(variable);
	}

	/**
	 * Consumes the next variable of the sum. Pushing any other variable is a bug in the caller.
	 */
	public WeightedSum push(String variable, int value) {
		if (isDone()) {
			throw new InternalCompilerError("push of '" + variable + "' into the resolved sum " + this);
		}
		if (!variables.get(0).equals(variable)) {
			throw new InternalCompilerError("push of '" + variable + "' but " + this + " expects '" +
					variables.get(0) + "'");
		}
		int contribution = Math.multiplyExact(coefficients.get(0), value);
		return new WeightedSum(variables.subList(1, variables.size()), coefficients.subList(1, coefficients.size()),
				Math.addExact(constant, contribution));
	}

	/**
	 * Consumes the variable if the sum mentions it, and leaves the sum unchanged otherwise.
	 */
	public WeightedSum feed(String variable, int value) {
		if (!mentions(variable)) {
			return this;
		}
		return push(variable, value);
	}

	public int value() {
		if (!isDone()) {
			throw new InternalCompilerError("value of unresolved sum " + this);
		}
		return constant;
	}

	public int getConstant() {
		return constant;
	}

	/**
	 * @return the remaining coefficients in variable order
	 */
	public Map<String, Integer> getCoefficients() {
		Map<String, Integer> result = new LinkedHashMap<>();
		for (int i = 0; i < variables.size(); i++) {
			result.put(variables.get(i), coefficients.get(i));
		}
		return result;
	}

	@Override
	public int hashCode() {
		return Objects.hash(variables, coefficients, constant);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		WeightedSum other = (WeightedSum) obj;
		return constant == other.constant && variables.equals(other.variables) &&
				coefficients.equals(other.coefficients);
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < variables.size(); i++) {
			int coefficient = coefficients.get(i);
			if (builder.length() > 0) {
				builder.append(coefficient < 0 ? " - " : " + ");
			} else if (coefficient < 0) {
				builder.append("-");
			}
			int magnitude = Math.abs(coefficient);
			if (magnitude != 1) {
				builder.append(magnitude).append("*");
			}
			builder.append(variables.get(i));
		}
		if (builder.length() == 0) {
			return Integer.toString(constant);
		}
		if (constant != 0) {
			builder.append(constant < 0 ? " - " : " + ").append(Math.abs(constant));
		}
		return builder.toString();
	}

}
