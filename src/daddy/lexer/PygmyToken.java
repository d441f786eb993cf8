package daddy.lexer;

import daddy.util.SourceLocatable;
import daddy.util.SourceLocation;

import java.util.Objects;

public class PygmyToken extends SourceLocatable {

	private final String value;
	private final PygmyTokenType type;
	private final SourceLocation location;

	public PygmyToken(String value, PygmyTokenType type, SourceLocation location) {
		this.value = value;
		this.type = type;
		this.location = location;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	public String getValue() {
		return value;
	}

	public PygmyTokenType getType() {
		return type;
	}

	public boolean is(PygmyTokenType type, String value) {
		return this.type == type && this.value.equals(value);
	}

	public boolean isBuiltin(String value) {
		return is(PygmyTokenType.BUILTIN, value);
	}

	@Override
	public String toString() {
		return "PygmyToken [value=" + value + ", type=" + type + ", location=" + location + "]";
	}

	@Override
	public int hashCode() {
		return Objects.hash(value, type, location);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		PygmyToken other = (PygmyToken) obj;
		return type == other.type && Objects.equals(value, other.value) &&
				Objects.equals(location, other.location);
	}

}
