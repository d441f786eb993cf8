package daddy.model.ddd;

import java.util.Objects;

/**
 * One arc of a diagram path: a state variable and the value it holds.
 */
public final class Edge {

	private final String variable;
	private final int value;

	public Edge(String variable, int value) {
		this.variable = variable;
		this.value = value;
	}

	public String getVariable() {
		return variable;
	}

	public int getValue() {
		return value;
	}

	public Edge withValue(int newValue) {
		return new Edge(variable, newValue);
	}

	@Override
	public int hashCode() {
		return Objects.hash(variable, value);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		Edge other = (Edge) obj;
		return value == other.value && Objects.equals(variable, other.variable);
	}

	@Override
	public String toString() {
		return variable + "=" + value;
	}

}
