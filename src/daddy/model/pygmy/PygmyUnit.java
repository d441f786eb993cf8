package daddy.model.pygmy;

import daddy.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The parsed content of one source file.
 */
public class PygmyUnit extends PygmyNode {

	private final List<PygmyDeclaration> declarations;

	public PygmyUnit(SourceLocation location, List<PygmyDeclaration> declarations) {
		super(location);
		this.declarations = Collections.unmodifiableList(declarations);
	}

	public List<PygmyDeclaration> getDeclarations() {
		return declarations;
	}

	@Override
	public <T, E extends Throwable> T accept(PygmyNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(declarations);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		PygmyUnit other = (PygmyUnit) obj;
		return Objects.equals(declarations, other.declarations);
	}

}
