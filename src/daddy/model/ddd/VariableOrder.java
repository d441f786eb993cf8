package daddy.model.ddd;

import daddy.model.pygmy.PygmyModule;
import daddy.model.pygmy.PygmyStruct;
import daddy.model.pygmy.PygmyVar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The fixed order in which every diagram path presents the state variables.
 *
 * State variables of a module are its scalar components: {@code x} for a scalar, {@code a[i]} for array
 * elements, {@code p.f} for struct fields, combined as needed ({@code ps[1].f}).
 */
public final class VariableOrder {

	private final List<String> variables;
	private final Map<String, Integer> indices;

	private VariableOrder(List<String> variables) {
		this.variables = Collections.unmodifiableList(new ArrayList<>(variables));
		this.indices = new HashMap<>();
		for (int i = 0; i < variables.size(); i++) {
			if (indices.put(variables.get(i), i) != null) {
				throw new IllegalArgumentException("duplicate variable '" + variables.get(i) + "'");
			}
		}
	}

	public static VariableOrder of(List<String> variables) {
		return new VariableOrder(variables);
	}

	public static VariableOrder of(String... variables) {
		return new VariableOrder(Arrays.asList(variables));
	}

	public static VariableOrder fromModule(PygmyModule module) {
		List<Edge> edges = new ArrayList<>();
		for (PygmyVar var : module.getVars().values()) {
			flatten(module, var.getName(), var, var.getInit(), edges);
		}
		List<String> variables = new ArrayList<>();
		for (Edge edge : edges) {
			variables.add(edge.getVariable());
		}
		return new VariableOrder(variables);
	}

	/**
	 * @return the path holding the initial value of every state variable of the module, 0 when not initialised
	 */
	public static PathDiagram initialState(PygmyModule module) {
		List<Edge> edges = new ArrayList<>();
		for (PygmyVar var : module.getVars().values()) {
			flatten(module, var.getName(), var, var.getInit(), edges);
		}
		return PathDiagram.of(edges);
	}

	private static void flatten(PygmyModule module, String prefix, PygmyVar var, Object init, List<Edge> out) {
		if (var.isArray()) {
			for (int i = 0; i < var.getSize(); i++) {
				Object element = init instanceof List ? ((List<?>) init).get(i) : init;
				flattenElement(module, prefix + "[" + i + "]", var, element, out);
			}
		} else {
			flattenElement(module, prefix, var, init, out);
		}
	}

	private static void flattenElement(PygmyModule module, String name, PygmyVar var, Object init, List<Edge> out) {
		if (var.getType().isStruct()) {
			PygmyStruct struct = module.getStructs().get(var.getType().getName());
			for (PygmyVar field : struct.getFields()) {
				flatten(module, name + "." + field.getName(), field, field.getInit(), out);
			}
			return;
		}
		int value = 0;
		if (init instanceof Boolean) {
			value = (Boolean) init ? 1 : 0;
		} else if (init instanceof Integer) {
			value = (Integer) init;
		}
		out.add(new Edge(name, value));
	}

	public List<String> getVariables() {
		return variables;
	}

	public int size() {
		return variables.size();
	}

	public boolean contains(String variable) {
		return indices.containsKey(variable);
	}

	/**
	 * @return the position of the variable, or -1 if it is not a state variable
	 */
	public int indexOf(String variable) {
		return indices.getOrDefault(variable, -1);
	}

	@Override
	public int hashCode() {
		return variables.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		return variables.equals(((VariableOrder) obj).variables);
	}

	@Override
	public String toString() {
		return variables.toString();
	}

}
