package daddy.model.pygmy;

import daddy.util.SourceLocation;

import java.util.Objects;

public class PygmyName extends PygmyLookup {

	private final String id;

	public PygmyName(SourceLocation location, String id) {
		super(location);
		this.id = id;
	}

	public String getId() {
		return id;
	}

	@Override
	public PygmyName getRoot() {
		return this;
	}

	@Override
	public PygmyLookup withRoot(PygmyName root) {
		return root;
	}

	@Override
	public <T, E extends Throwable> T accept(PygmyExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(id);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		PygmyName other = (PygmyName) obj;
		return Objects.equals(id, other.id);
	}

}
