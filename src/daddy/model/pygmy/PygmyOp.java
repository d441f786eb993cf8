package daddy.model.pygmy;

import daddy.util.SourceLocation;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An operator applied to its children. Unary operators ({@code -} and {@code not}) have one child, {@code and} and
 * {@code or} may have more than two.
 */
public class PygmyOp extends PygmyExpression {

	public static final List<String> COMPARISONS = Collections.unmodifiableList(
			Arrays.asList("==", "!=", "<", "<=", ">", ">="));

	private final String op;
	private final List<PygmyExpression> children;

	public PygmyOp(SourceLocation location, String op, List<PygmyExpression> children) {
		super(location);
		this.op = op;
		this.children = Collections.unmodifiableList(children);
	}

	public String getOp() {
		return op;
	}

	public List<PygmyExpression> getChildren() {
		return children;
	}

	public boolean isComparison() {
		return COMPARISONS.contains(op);
	}

	@Override
	public <T, E extends Throwable> T accept(PygmyExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(op, children);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		PygmyOp other = (PygmyOp) obj;
		return Objects.equals(op, other.op) && Objects.equals(children, other.children);
	}

}
