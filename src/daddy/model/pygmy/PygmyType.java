package daddy.model.pygmy;

import java.util.Objects;

/**
 * The element type of a variable: one of the base types or a declared struct.
 */
public final class PygmyType {

	public static final PygmyType INT = new PygmyType("int", false);
	public static final PygmyType BOOL = new PygmyType("bool", false);

	private final String name;
	private final boolean struct;

	private PygmyType(String name, boolean struct) {
		this.name = name;
		this.struct = struct;
	}

	public static PygmyType struct(String name) {
		return new PygmyType(name, true);
	}

	public String getName() {
		return name;
	}

	public boolean isStruct() {
		return struct;
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, struct);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		PygmyType other = (PygmyType) obj;
		return struct == other.struct && Objects.equals(name, other.name);
	}

	@Override
	public String toString() {
		return name;
	}

}
