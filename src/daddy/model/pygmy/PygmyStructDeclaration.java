package daddy.model.pygmy;

import daddy.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class PygmyStructDeclaration extends PygmyDeclaration {

	private final PygmyName name;
	private final List<PygmyExpression> parents;
	private final List<PygmyVarDeclaration> fields;

	public PygmyStructDeclaration(SourceLocation location, PygmyName name, List<PygmyExpression> parents,
	                              List<PygmyVarDeclaration> fields) {
		super(location);
		this.name = name;
		this.parents = Collections.unmodifiableList(parents);
		this.fields = Collections.unmodifiableList(fields);
	}

	public PygmyName getName() {
		return name;
	}

	public List<PygmyExpression> getParents() {
		return parents;
	}

	public List<PygmyVarDeclaration> getFields() {
		return fields;
	}

	@Override
	public <T, E extends Throwable> T accept(PygmyDeclarationVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, parents, fields);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		PygmyStructDeclaration other = (PygmyStructDeclaration) obj;
		return Objects.equals(name, other.name) && Objects.equals(parents, other.parents) &&
				Objects.equals(fields, other.fields);
	}

}
