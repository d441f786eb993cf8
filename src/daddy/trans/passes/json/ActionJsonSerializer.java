package daddy.trans.passes.json;

import daddy.model.ddd.VariableOrder;
import daddy.model.hom.Action;
import daddy.model.hom.Condition;
import daddy.model.hom.WeightedSum;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.List;
import java.util.Map;

/**
 * Writes compiled actions as JSON:
 *
 * <pre>
 * {"order": ["x", ...],
 *  "actions": {"entry": [{"guard": [{"coefs": {"x": 1}, "const": -3, "op": "&lt;="}],
 *                         "effect": {"x": {"coefs": {"y": 2}, "const": 1}}}]}}
 * </pre>
 *
 * Conditions compare their sum against zero; variables missing from an effect keep their value.
 */
public class ActionJsonSerializer {
	private ActionJsonSerializer() {}

	public static JSONObject sum(WeightedSum sum) {
		JSONObject coefs = new JSONObject();
		for (Map.Entry<String, Integer> term : sum.getCoefficients().entrySet()) {
			coefs.put(term.getKey(), term.getValue().intValue());
		}
		return new JSONObject()
				.put("coefs", coefs)
				.put("const", sum.getConstant());
	}

	public static JSONObject condition(Condition condition) {
		return sum(condition.getSum()).put("op", condition.getComparator().getSymbol());
	}

	public static JSONObject action(Action action) {
		JSONArray guard = new JSONArray();
		for (Condition condition : action.getGuard()) {
			guard.put(condition(condition));
		}
		JSONObject effect = new JSONObject();
		for (Map.Entry<String, WeightedSum> assignment : action.getEffect().entrySet()) {
			if (!assignment.getValue().equals(WeightedSum.identity(assignment.getKey()))) {
				effect.put(assignment.getKey(), sum(assignment.getValue()));
			}
		}
		return new JSONObject()
				.put("guard", guard)
				.put("effect", effect);
	}

	public static JSONObject serialize(VariableOrder order, Map<String, List<Action>> actions) {
		JSONObject entries = new JSONObject();
		for (Map.Entry<String, List<Action>> entry : actions.entrySet()) {
			JSONArray list = new JSONArray();
			for (Action action : entry.getValue()) {
				list.put(action(action));
			}
			entries.put(entry.getKey(), list);
		}
		return new JSONObject()
				.put("order", new JSONArray(order.getVariables()))
				.put("actions", entries);
	}
}
