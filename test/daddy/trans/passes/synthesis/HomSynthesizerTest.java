package daddy.trans.passes.synthesis;

import daddy.model.ddd.Edge;
import daddy.model.ddd.PathDiagram;
import daddy.model.ddd.VariableOrder;
import daddy.model.hom.*;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

@RunWith(Parameterized.class)
public class HomSynthesizerTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][]{
				{VariableOrder.of("t", "s", "o")},
				{VariableOrder.of("s", "t", "o")},
				{VariableOrder.of("o", "s", "t")},
				{VariableOrder.of("t", "o", "s")},
		});
	}

	private static final int[] VALUES = {-3, 0, 1, 4};
	private static final int[] MULTIPLIERS = {-2, -1, 0, 1, 3};
	private static final int[] INCREMENTS = {-1, 0, 5};

	private final VariableOrder order;

	public HomSynthesizerTest(VariableOrder order) {
		this.order = order;
	}

	private PathDiagram path(Map<String, Integer> values) {
		List<Edge> edges = new ArrayList<>();
		for (String variable : order.getVariables()) {
			edges.add(new Edge(variable, values.get(variable)));
		}
		return PathDiagram.of(edges);
	}

	private List<Map<String, Integer>> states() {
		List<Map<String, Integer>> result = new ArrayList<>();
		for (int t : VALUES) {
			for (int s : VALUES) {
				Map<String, Integer> state = new HashMap<>();
				state.put("t", t);
				state.put("s", s);
				state.put("o", 7);
				result.add(state);
			}
		}
		return result;
	}

	private void assertInOrder(PathDiagram path) {
		List<String> variables = new ArrayList<>();
		for (Edge edge : path.getEdges()) {
			variables.add(edge.getVariable());
		}
		assertThat(variables, is(order.getVariables()));
	}

	@Test
	public void assignmentMatchesItsArithmetic() {
		for (boolean augment : new boolean[]{false, true}) {
			for (int mul : MULTIPLIERS) {
				for (int inc : INCREMENTS) {
					Hom hom = HomSynthesizer.ass(order, "t", "s", augment, inc, mul);
					for (Map<String, Integer> state : states()) {
						PathDiagram result = PathDiagram.from(hom.apply(path(state)));
						int expected = (augment ? state.get("t") : 0) + mul * state.get("s") + inc;
						assertInOrder(result);
						assertThat(hom.toString(), result.get("t"), is(expected));
						assertThat(result.get("s"), is(state.get("s")));
						assertThat(result.get("o"), is(7));
					}
				}
			}
		}
	}

	@Test
	public void selfAssignment() {
		for (boolean augment : new boolean[]{false, true}) {
			for (int mul : MULTIPLIERS) {
				for (int inc : INCREMENTS) {
					Hom hom = HomSynthesizer.ass(order, "t", "t", augment, inc, mul);
					for (Map<String, Integer> state : states()) {
						int v = state.get("t");
						PathDiagram result = PathDiagram.from(hom.apply(path(state)));
						assertInOrder(result);
						assertThat(result.get("t"), is((augment ? v : 0) + mul * v + inc));
					}
				}
			}
		}
	}

	@Test
	public void degenerateAssignmentIsIdentity() {
		Hom hom = HomSynthesizer.ass(order, "t", "s", true, 0, 0);
		assertThat(hom, instanceOf(IdentityHom.class));
		for (Map<String, Integer> state : states()) {
			assertThat(PathDiagram.from(hom.apply(path(state))), is(path(state)));
		}
	}

	@Test
	public void generalAssignment() {
		Map<String, Integer> coefficients = new HashMap<>();
		coefficients.put("s", 2);
		coefficients.put("o", -1);
		coefficients.put("t", 1);
		Hom hom = HomSynthesizer.assign(order, "t", coefficients, 3);
		for (Map<String, Integer> state : states()) {
			PathDiagram result = PathDiagram.from(hom.apply(path(state)));
			assertInOrder(result);
			assertThat(result.get("t"), is(state.get("t") + 2 * state.get("s") - 7 + 3));
		}
	}

	@Test
	public void falseGuardYieldsNoPath() {
		Map<String, Integer> coefficients = new HashMap<>();
		coefficients.put("s", 1);
		// s > 0
		Condition positive = new Condition(WeightedSum.of(order, coefficients, 0), Comparator.GT);
		Map<String, WeightedSum> effect = new LinkedHashMap<>();
		effect.put("t", WeightedSum.constant(42));
		Hom hom = HomSynthesizer.synthesize(order, Collections.singletonList(positive), effect);
		for (Map<String, Integer> state : states()) {
			PathDiagram result = PathDiagram.from(hom.apply(path(state)));
			if (state.get("s") > 0) {
				assertInOrder(result);
				assertThat(result.get("t"), is(42));
			} else {
				assertTrue(result.isNull());
			}
		}
	}

	@Test
	public void trueGuardAppliesTheEffect() {
		Map<String, Integer> coefficients = new HashMap<>();
		coefficients.put("s", 1);
		coefficients.put("t", 1);
		Map<String, WeightedSum> effect = new LinkedHashMap<>();
		effect.put("t", WeightedSum.of(order, coefficients, 0));
		effect.put("s", WeightedSum.constant(0));
		Hom action = HomSynthesizer.synthesize(order, Collections.emptyList(), effect);
		for (Map<String, Integer> state : states()) {
			Map<String, Integer> expected = new HashMap<>(state);
			expected.put("t", state.get("t") + state.get("s"));
			expected.put("s", 0);
			assertThat(PathDiagram.from(action.apply(path(state))), is(path(expected)));
		}
	}

	@Test
	public void partialEffectKeepsOtherVariables() {
		Hom action = new ActionHom(new Action(Collections.emptyList(),
				Collections.singletonMap("o", WeightedSum.of(order, Collections.singletonMap("t", 1), 1))));
		for (Map<String, Integer> state : states()) {
			Map<String, Integer> expected = new HashMap<>(state);
			expected.put("o", state.get("t") + 1);
			assertThat(PathDiagram.from(action.apply(path(state))), is(path(expected)));
		}
	}

	@Test
	public void sequenceAppliesInListOrder() {
		Hom hom = HomSynthesizer.sequence(Arrays.asList(
				HomSynthesizer.ass(order, "t", "s", false, 0, 1),
				HomSynthesizer.ass(order, "s", "s", true, 1, 0),
				HomSynthesizer.ass(order, "t", "s", true, 0, 2)));
		for (Map<String, Integer> state : states()) {
			int s = state.get("s");
			PathDiagram result = PathDiagram.from(hom.apply(path(state)));
			assertInOrder(result);
			assertThat(result.get("s"), is(s + 1));
			assertThat(result.get("t"), is(s + 2 * (s + 1)));
		}
	}

	@Test
	public void equalHomsAreInterchangeable() {
		assertThat(HomSynthesizer.ass(order, "t", "s", false, 1, 2),
				is(HomSynthesizer.ass(order, "t", "s", false, 1, 2)));
		assertThat(HomSynthesizer.ass(order, "t", "s", false, 1, 2).hashCode(),
				is(HomSynthesizer.ass(order, "t", "s", false, 1, 2).hashCode()));
	}

}
