package daddy.model.pygmy;

import daddy.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class PygmyIf extends PygmyStatement {

	private final PygmyExpression condition;
	private final List<PygmyStatement> then;
	private final List<PygmyStatement> orElse;

	public PygmyIf(SourceLocation location, PygmyExpression condition, List<PygmyStatement> then,
	               List<PygmyStatement> orElse) {
		super(location);
		this.condition = condition;
		this.then = Collections.unmodifiableList(then);
		this.orElse = Collections.unmodifiableList(orElse);
	}

	public PygmyExpression getCondition() {
		return condition;
	}

	public List<PygmyStatement> getThen() {
		return then;
	}

	public List<PygmyStatement> getOrElse() {
		return orElse;
	}

	@Override
	public <T, E extends Throwable> T accept(PygmyStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(condition, then, orElse);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		PygmyIf other = (PygmyIf) obj;
		return Objects.equals(condition, other.condition) && Objects.equals(then, other.then) &&
				Objects.equals(orElse, other.orElse);
	}

}
