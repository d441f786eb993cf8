package daddy.trans.passes.scope;

import daddy.model.pygmy.PygmyType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The only importable module, exporting the base types and the compile-time helpers.
 */
public final class PygmyBuiltinModule {

	public static final String NAME = "pygmy";
	public static final PygmyBuiltinModule INSTANCE = new PygmyBuiltinModule();

	private final Map<String, Object> exports;

	private PygmyBuiltinModule() {
		Map<String, Object> e = new LinkedHashMap<>();
		e.put("int", PygmyType.INT);
		e.put("bool", PygmyType.BOOL);
		for (PygmyBuiltinFunction function : PygmyBuiltinFunction.values()) {
			e.put(function.getName(), function);
		}
		exports = Collections.unmodifiableMap(e);
	}

	public Map<String, Object> getExports() {
		return exports;
	}

	/**
	 * @return the names every module starts with: the exports, and the module itself
	 */
	public static Map<String, Object> initialEnvironment() {
		Map<String, Object> env = new LinkedHashMap<>(INSTANCE.exports);
		env.put(NAME, INSTANCE);
		return env;
	}

	/**
	 * @return the name under which the module exports the given value, or null
	 */
	public String exportName(Object value) {
		for (Map.Entry<String, Object> export : exports.entrySet()) {
			if (export.getValue().equals(value)) {
				return export.getKey();
			}
		}
		return null;
	}

	@Override
	public String toString() {
		return "module " + NAME;
	}
}
