package daddy.model.pygmy;

import daddy.util.SourceLocation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Either {@code import module [as alias]} (names is empty) or {@code from module import name [as alias], ...}
 * (alias is null). The names map goes from the bound name to the imported one.
 */
public class PygmyImport extends PygmyDeclaration {

	private final String module;
	private final String alias;
	private final Map<String, String> names;

	public PygmyImport(SourceLocation location, String module, String alias, Map<String, String> names) {
		super(location);
		this.module = module;
		this.alias = alias;
		this.names = Collections.unmodifiableMap(new LinkedHashMap<>(names));
	}

	public String getModule() {
		return module;
	}

	public String getAlias() {
		return alias;
	}

	public Map<String, String> getNames() {
		return names;
	}

	public boolean isFromImport() {
		return !names.isEmpty();
	}

	@Override
	public <T, E extends Throwable> T accept(PygmyDeclarationVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(module, alias, names);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		PygmyImport other = (PygmyImport) obj;
		return Objects.equals(module, other.module) && Objects.equals(alias, other.alias) &&
				Objects.equals(names, other.names);
	}

}
