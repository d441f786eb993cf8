package daddy.model.pygmy;

import daddy.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A resolved record type. Fields inherited from the parents come first, in parent order.
 */
public class PygmyStruct extends PygmyNode {

	private final String name;
	private final List<String> parents;
	private final List<PygmyVar> fields;

	public PygmyStruct(SourceLocation location, String name, List<String> parents, List<PygmyVar> fields) {
		super(location);
		this.name = name;
		this.parents = Collections.unmodifiableList(parents);
		this.fields = Collections.unmodifiableList(fields);
	}

	public String getName() {
		return name;
	}

	public List<String> getParents() {
		return parents;
	}

	public List<PygmyVar> getFields() {
		return fields;
	}

	public Optional<PygmyVar> getField(String fieldName) {
		return fields.stream().filter(f -> f.getName().equals(fieldName)).findFirst();
	}

	@Override
	public <T, E extends Throwable> T accept(PygmyNodeVisitor<T, E> v) throws E {
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
		PygmyStruct other = (PygmyStruct) obj;
		return Objects.equals(name, other.name) && Objects.equals(parents, other.parents) &&
				Objects.equals(fields, other.fields);
	}

}
