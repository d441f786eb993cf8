package daddy.model.pygmy;

import daddy.util.SourceLocation;

import java.util.Objects;

/**
 * NAME: type = init, or NAME: type[size] = init for arrays. Size and init are null when omitted.
 */
public class PygmyVarDeclaration extends PygmyDeclaration {

	private final PygmyName name;
	private final PygmyExpression type;
	private final PygmyExpression size;
	private final PygmyExpression init;

	public PygmyVarDeclaration(SourceLocation location, PygmyName name, PygmyExpression type, PygmyExpression size,
	                           PygmyExpression init) {
		super(location);
		this.name = name;
		this.type = type;
		this.size = size;
		this.init = init;
	}

	public PygmyName getName() {
		return name;
	}

	public PygmyExpression getType() {
		return type;
	}

	public PygmyExpression getSize() {
		return size;
	}

	public PygmyExpression getInit() {
		return init;
	}

	@Override
	public <T, E extends Throwable> T accept(PygmyDeclarationVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, type, size, init);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		PygmyVarDeclaration other = (PygmyVarDeclaration) obj;
		return Objects.equals(name, other.name) && Objects.equals(type, other.type) &&
				Objects.equals(size, other.size) && Objects.equals(init, other.init);
	}

}
