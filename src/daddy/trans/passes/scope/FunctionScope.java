package daddy.trans.passes.scope;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * What the names inside one function body refer to. Loop variables are added and removed while walking the
 * body; everything else is fixed once the declarations of the function have been read.
 */
public class FunctionScope {

	private final String function;
	private final Map<String, Object> statics;
	private final Set<String> moduleVars;
	private final Set<String> funcs;
	private final Set<String> params = new HashSet<>();
	private final Set<String> globals = new HashSet<>();
	private final Map<String, String> locals = new LinkedHashMap<>();
	private final Set<String> loopVariables = new HashSet<>();

	public FunctionScope(String function, Map<String, Object> statics, Set<String> moduleVars, Set<String> funcs) {
		this.function = function;
		this.statics = Collections.unmodifiableMap(statics);
		this.moduleVars = moduleVars;
		this.funcs = funcs;
	}

	public String getFunction() {
		return function;
	}

	public Map<String, Object> getStatics() {
		return statics;
	}

	public void addParam(String name) {
		params.add(name);
	}

	public void addGlobal(String name) {
		globals.add(name);
	}

	public String addLocal(String name) {
		String renamed = function + "_" + name;
		locals.put(name, renamed);
		return renamed;
	}

	public void enterLoop(String variable) {
		loopVariables.add(variable);
	}

	public void exitLoop(String variable) {
		loopVariables.remove(variable);
	}

	public boolean isModuleVar(String name) {
		return moduleVars.contains(name);
	}

	public String getRenamedLocal(String name) {
		return locals.get(name);
	}

	public NameKind classify(String name) {
		if (loopVariables.contains(name)) {
			return NameKind.LOOP_VARIABLE;
		} else if (params.contains(name)) {
			return NameKind.PARAMETER;
		} else if (locals.containsKey(name)) {
			return NameKind.LOCAL;
		} else if (globals.contains(name)) {
			return NameKind.GLOBAL;
		} else if (funcs.contains(name)) {
			return NameKind.FUNCTION;
		} else if (statics.containsKey(name)) {
			return NameKind.STATIC;
		} else if (moduleVars.contains(name)) {
			return NameKind.MODULE_VARIABLE;
		}
		return NameKind.UNDECLARED;
	}

}
