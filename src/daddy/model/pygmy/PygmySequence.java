package daddy.model.pygmy;

import daddy.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A list or tuple literal. Only meaningful where a compile-time value is expected (static bindings, initial
 * values, loop sequences).
 */
public class PygmySequence extends PygmyExpression {

	private final List<PygmyExpression> elements;

	public PygmySequence(SourceLocation location, List<PygmyExpression> elements) {
		super(location);
		this.elements = Collections.unmodifiableList(elements);
	}

	public List<PygmyExpression> getElements() {
		return elements;
	}

	@Override
	public <T, E extends Throwable> T accept(PygmyExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(elements);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		PygmySequence other = (PygmySequence) obj;
		return Objects.equals(elements, other.elements);
	}

}
