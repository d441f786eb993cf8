package daddy.trans.passes.json;

import daddy.model.ddd.VariableOrder;
import daddy.model.hom.Action;
import daddy.model.hom.Comparator;
import daddy.model.hom.Condition;
import daddy.model.hom.WeightedSum;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;

public class ActionJsonSerializerTest {

	private static final VariableOrder ORDER = VariableOrder.of("x", "y");

	@Test
	public void serialize() {
		Map<String, Integer> xMinusY = new LinkedHashMap<>();
		xMinusY.put("x", 1);
		xMinusY.put("y", -1);
		Map<String, WeightedSum> effect = new LinkedHashMap<>();
		effect.put("x", WeightedSum.of(ORDER, Collections.singletonMap("y", 2), 1));
		effect.put("y", WeightedSum.identity("y"));
		Action action = new Action(
				Collections.singletonList(new Condition(WeightedSum.of(ORDER, xMinusY, -3), Comparator.LE)),
				effect);
		Map<String, List<Action>> actions = new LinkedHashMap<>();
		actions.put("step", Collections.singletonList(action));

		JSONObject json = ActionJsonSerializer.serialize(ORDER, actions);

		assertThat(json.getJSONArray("order").toList(), is(Arrays.<Object>asList("x", "y")));
		JSONArray step = json.getJSONObject("actions").getJSONArray("step");
		assertThat(step.length(), is(1));

		JSONObject guard = step.getJSONObject(0).getJSONArray("guard").getJSONObject(0);
		assertThat(guard.getString("op"), is("<="));
		assertThat(guard.getInt("const"), is(-3));
		assertThat(guard.getJSONObject("coefs").getInt("x"), is(1));
		assertThat(guard.getJSONObject("coefs").getInt("y"), is(-1));

		JSONObject jsonEffect = step.getJSONObject(0).getJSONObject("effect");
		// unchanged variables are left out
		assertFalse(jsonEffect.has("y"));
		assertThat(jsonEffect.getJSONObject("x").getInt("const"), is(1));
		assertThat(jsonEffect.getJSONObject("x").getJSONObject("coefs").getInt("y"), is(2));
		assertFalse(jsonEffect.getJSONObject("x").getJSONObject("coefs").has("x"));
	}

}
