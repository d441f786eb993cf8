package daddy.model.pygmy;

import daddy.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * global a, b
 */
public class PygmyGlobal extends PygmyNode {

	private final List<PygmyName> names;

	public PygmyGlobal(SourceLocation location, List<PygmyName> names) {
		super(location);
		this.names = Collections.unmodifiableList(names);
	}

	public List<PygmyName> getNames() {
		return names;
	}

	@Override
	public <T, E extends Throwable> T accept(PygmyNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(names);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		PygmyGlobal other = (PygmyGlobal) obj;
		return Objects.equals(names, other.names);
	}

}
