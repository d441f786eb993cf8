package daddy.model.pygmy;

import daddy.util.SourceLocation;

import java.util.Objects;

/**
 * An integer or boolean literal.
 */
public class PygmyConst extends PygmyExpression {

	private final Object value;

	public PygmyConst(SourceLocation location, int value) {
		super(location);
		this.value = value;
	}

	public PygmyConst(SourceLocation location, boolean value) {
		super(location);
		this.value = value;
	}

	public Object getValue() {
		return value;
	}

	public boolean isBoolean() {
		return value instanceof Boolean;
	}

	/**
	 * @return the value as it is stored on a diagram edge, booleans being 0 or 1
	 */
	public int asInt() {
		if (value instanceof Boolean) {
			return (Boolean) value ? 1 : 0;
		}
		return (Integer) value;
	}

	public boolean asBoolean() {
		if (value instanceof Boolean) {
			return (Boolean) value;
		}
		return (Integer) value != 0;
	}

	@Override
	public <T, E extends Throwable> T accept(PygmyExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(value);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		PygmyConst other = (PygmyConst) obj;
		return Objects.equals(value, other.value);
	}

}
