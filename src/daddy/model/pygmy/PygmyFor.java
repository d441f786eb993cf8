package daddy.model.pygmy;

import daddy.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * for variable in iterable: body
 *
 * The iterable has to reduce to a compile-time sequence, the loop is unrolled before inlining.
 */
public class PygmyFor extends PygmyStatement {

	private final PygmyName variable;
	private final PygmyExpression iterable;
	private final List<PygmyStatement> body;

	public PygmyFor(SourceLocation location, PygmyName variable, PygmyExpression iterable,
	                List<PygmyStatement> body) {
		super(location);
		this.variable = variable;
		this.iterable = iterable;
		this.body = Collections.unmodifiableList(body);
	}

	public PygmyName getVariable() {
		return variable;
	}

	public PygmyExpression getIterable() {
		return iterable;
	}

	public List<PygmyStatement> getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(PygmyStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(variable, iterable, body);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		PygmyFor other = (PygmyFor) obj;
		return Objects.equals(variable, other.variable) && Objects.equals(iterable, other.iterable) &&
				Objects.equals(body, other.body);
	}

}
