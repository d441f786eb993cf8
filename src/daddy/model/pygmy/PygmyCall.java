package daddy.model.pygmy;

import daddy.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class PygmyCall extends PygmyExpression {

	private final PygmyLookup function;
	private final List<PygmyExpression> arguments;

	public PygmyCall(SourceLocation location, PygmyLookup function, List<PygmyExpression> arguments) {
		super(location);
		this.function = function;
		this.arguments = Collections.unmodifiableList(arguments);
	}

	public PygmyLookup getFunction() {
		return function;
	}

	public List<PygmyExpression> getArguments() {
		return arguments;
	}

	@Override
	public <T, E extends Throwable> T accept(PygmyExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(function, arguments);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		PygmyCall other = (PygmyCall) obj;
		return Objects.equals(function, other.function) && Objects.equals(arguments, other.arguments);
	}

}
