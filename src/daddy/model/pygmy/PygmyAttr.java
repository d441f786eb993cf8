package daddy.model.pygmy;

import daddy.util.SourceLocation;

import java.util.Objects;

/**
 * Field access, value.attr
 */
public class PygmyAttr extends PygmyLookup {

	private final PygmyLookup value;
	private final String attr;

	public PygmyAttr(SourceLocation location, PygmyLookup value, String attr) {
		super(location);
		this.value = value;
		this.attr = attr;
	}

	public PygmyLookup getValue() {
		return value;
	}

	public String getAttr() {
		return attr;
	}

	@Override
	public PygmyName getRoot() {
		return value.getRoot();
	}

	@Override
	public PygmyLookup withRoot(PygmyName root) {
		return new PygmyAttr(getLocation(), value.withRoot(root), attr);
	}

	@Override
	public <T, E extends Throwable> T accept(PygmyExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value, attr);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		PygmyAttr other = (PygmyAttr) obj;
		return Objects.equals(value, other.value) && Objects.equals(attr, other.attr);
	}

}
