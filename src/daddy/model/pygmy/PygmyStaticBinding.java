package daddy.model.pygmy;

import daddy.util.SourceLocation;

import java.util.Objects;

/**
 * NAME = expr at module level. The value is evaluated at compile time.
 */
public class PygmyStaticBinding extends PygmyDeclaration {

	private final PygmyName name;
	private final PygmyExpression value;

	public PygmyStaticBinding(SourceLocation location, PygmyName name, PygmyExpression value) {
		super(location);
		this.name = name;
		this.value = value;
	}

	public PygmyName getName() {
		return name;
	}

	public PygmyExpression getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(PygmyDeclarationVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, value);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		PygmyStaticBinding other = (PygmyStaticBinding) obj;
		return Objects.equals(name, other.name) && Objects.equals(value, other.value);
	}

}
