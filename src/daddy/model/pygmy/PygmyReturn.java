package daddy.model.pygmy;

import daddy.util.SourceLocation;

import java.util.Objects;

public class PygmyReturn extends PygmyStatement {

	private final PygmyExpression value;

	/**
	 * @param value the returned expression, null for a bare return
	 */
	public PygmyReturn(SourceLocation location, PygmyExpression value) {
		super(location);
		this.value = value;
	}

	public PygmyExpression getValue() {
		return value;
	}

	public boolean hasValue() {
		return value != null;
	}

	@Override
	public <T, E extends Throwable> T accept(PygmyStatementVisitor<T, E> v) throws E {
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
		PygmyReturn other = (PygmyReturn) obj;
		return Objects.equals(value, other.value);
	}

}
