package daddy.model.pygmy;

import daddy.util.SourceLocation;

import java.util.Objects;

/**
 * A resolved variable. The size is null for scalars; the initial value is null (meaning 0), an Integer, a
 * Boolean, or for arrays a List with one value per element.
 */
public class PygmyVar extends PygmyNode {

	private final String name;
	private final PygmyType type;
	private final Integer size;
	private final Object init;

	public PygmyVar(SourceLocation location, String name, PygmyType type, Integer size, Object init) {
		super(location);
		this.name = name;
		this.type = type;
		this.size = size;
		this.init = init;
	}

	public String getName() {
		return name;
	}

	public PygmyType getType() {
		return type;
	}

	public Integer getSize() {
		return size;
	}

	public boolean isArray() {
		return size != null;
	}

	public Object getInit() {
		return init;
	}

	public PygmyVar withName(String name) {
		return new PygmyVar(getLocation(), name, type, size, init);
	}

	@Override
	public <T, E extends Throwable> T accept(PygmyNodeVisitor<T, E> v) throws E {
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
		PygmyVar other = (PygmyVar) obj;
		return Objects.equals(name, other.name) && Objects.equals(type, other.type) &&
				Objects.equals(size, other.size) && Objects.equals(init, other.init);
	}

}
