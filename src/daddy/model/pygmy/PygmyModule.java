package daddy.model.pygmy;

import daddy.util.SourceLocation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A resolved compilation unit. All maps keep declaration order.
 *
 * Constants are the module-level bindings holding data (integers, booleans and sequences of those); function
 * bodies may still refer to sequence constants by name, scalar ones are already substituted.
 */
public class PygmyModule extends PygmyNode {

	private final Map<String, Object> constants;
	private final Map<String, PygmyVar> vars;
	private final Map<String, PygmyStruct> structs;
	private final Map<String, PygmyFunc> funcs;

	public PygmyModule(SourceLocation location, Map<String, Object> constants, Map<String, PygmyVar> vars,
	                   Map<String, PygmyStruct> structs, Map<String, PygmyFunc> funcs) {
		super(location);
		this.constants = Collections.unmodifiableMap(new LinkedHashMap<>(constants));
		this.vars = Collections.unmodifiableMap(new LinkedHashMap<>(vars));
		this.structs = Collections.unmodifiableMap(new LinkedHashMap<>(structs));
		this.funcs = Collections.unmodifiableMap(new LinkedHashMap<>(funcs));
	}

	public Map<String, Object> getConstants() {
		return constants;
	}

	public Map<String, PygmyVar> getVars() {
		return vars;
	}

	public Map<String, PygmyStruct> getStructs() {
		return structs;
	}

	public Map<String, PygmyFunc> getFuncs() {
		return funcs;
	}

	@Override
	public <T, E extends Throwable> T accept(PygmyNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(constants, vars, structs, funcs);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		PygmyModule other = (PygmyModule) obj;
		return Objects.equals(constants, other.constants) && Objects.equals(vars, other.vars) && Objects.equals(structs, other.structs) &&
				Objects.equals(funcs, other.funcs);
	}

}
