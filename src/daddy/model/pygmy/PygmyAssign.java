package daddy.model.pygmy;

import daddy.util.SourceLocation;

import java.util.Objects;

/**
 * target = value, or target op= value when op is not null ({@code +} or {@code -})
 */
public class PygmyAssign extends PygmyStatement {

	private final PygmyLookup target;
	private final PygmyExpression value;
	private final String op;

	public PygmyAssign(SourceLocation location, PygmyLookup target, PygmyExpression value, String op) {
		super(location);
		this.target = target;
		this.value = value;
		this.op = op;
	}

	public PygmyLookup getTarget() {
		return target;
	}

	public PygmyExpression getValue() {
		return value;
	}

	public String getOp() {
		return op;
	}

	public boolean isAugmented() {
		return op != null;
	}

	@Override
	public <T, E extends Throwable> T accept(PygmyStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(target, value, op);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		PygmyAssign other = (PygmyAssign) obj;
		return Objects.equals(target, other.target) && Objects.equals(value, other.value) &&
				Objects.equals(op, other.op);
	}

}
