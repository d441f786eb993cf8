package daddy.trans.passes.linear;

import daddy.errors.TopLevelIssueContext;
import daddy.model.ddd.VariableOrder;
import daddy.model.hom.Action;
import daddy.model.hom.Comparator;
import daddy.model.hom.Condition;
import daddy.model.hom.WeightedSum;
import daddy.model.pygmy.PygmyFunc;
import daddy.model.pygmy.PygmyStatement;
import daddy.model.pygmy.PygmyVar;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static daddy.model.pygmy.PygmyBuilder.*;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;

public class ActionExtractionPassTest {

	private static final VariableOrder ORDER = VariableOrder.of("x", "y", "a[0]", "a[1]");

	// sum(c, "x", 2, "y", -1) is 2*x - y + c
	private static WeightedSum sum(int constant, Object... terms) {
		Map<String, Integer> coefficients = new LinkedHashMap<>();
		for (int i = 0; i < terms.length; i += 2) {
			coefficients.put((String) terms[i], (Integer) terms[i + 1]);
		}
		return WeightedSum.of(ORDER, coefficients, constant);
	}

	private static Map<String, WeightedSum> effect(Object... assignments) {
		Map<String, WeightedSum> result = new LinkedHashMap<>();
		for (int i = 0; i < assignments.length; i += 2) {
			result.put((String) assignments[i], (WeightedSum) assignments[i + 1]);
		}
		return result;
	}

	private static List<Action> extract(List<PygmyVar> locals, PygmyStatement... body) {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		PygmyFunc func = func("f", Collections.emptyList(), Collections.emptyList(), locals, body);
		List<Action> actions = ActionExtractionPass.perform(ctx, ORDER, func);
		assertFalse(ctx.format(), ctx.hasErrors());
		return actions;
	}

	private static List<Action> extract(PygmyStatement... body) {
		return extract(Collections.emptyList(), body);
	}

	private static TopLevelIssueContext failing(PygmyStatement... body) {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		PygmyFunc func = func("f", Collections.emptyList(), Collections.emptyList(), Collections.emptyList(), body);
		assertThat(ActionExtractionPass.perform(ctx, ORDER, func), is(Collections.<Action>emptyList()));
		return ctx;
	}

	@Test
	public void effectsReadTheInitialState() {
		List<Action> actions = extract(
				assign(name("x"), op("+", name("y"), num(1))),
				assign(name("y"), op("*", name("x"), num(2))));
		assertThat(actions, is(Collections.singletonList(new Action(Collections.emptyList(), effect(
				"x", sum(1, "y", 1),
				"y", sum(2, "y", 2))))));
	}

	@Test
	public void augmentedAssignmentAndArrays() {
		List<Action> actions = extract(
				augAssign(item(name("a"), num(1)), "+", item(name("a"), num(0))),
				augAssign(name("x"), "-", op("-", num(3))));
		assertThat(actions, is(Collections.singletonList(new Action(Collections.emptyList(), effect(
				"x", sum(3, "x", 1),
				"a[1]", sum(0, "a[0]", 1, "a[1]", 1))))));
	}

	@Test
	public void conditionalSplitsIntoActions() {
		List<Action> actions = extract(
				ifS(op(">", name("x"), num(0)),
						block(assign(name("y"), num(1))),
						block(assign(name("y"), num(2)))));
		assertThat(actions, is(Arrays.asList(
				new Action(Collections.singletonList(new Condition(sum(0, "x", 1), Comparator.GT)),
						effect("y", WeightedSum.constant(1))),
				new Action(Collections.singletonList(new Condition(sum(0, "x", 1), Comparator.LE)),
						effect("y", WeightedSum.constant(2))))));
	}

	@Test
	public void disjunctionGivesOneActionPerAlternative() {
		List<Action> actions = extract(
				ifS(op("or", op("==", name("x"), num(0)), op("==", name("y"), num(0))),
						block(assign(name("x"), num(5))),
						Collections.emptyList()));
		assertThat(actions, is(Arrays.asList(
				new Action(Collections.singletonList(new Condition(sum(0, "x", 1), Comparator.EQ)),
						effect("x", WeightedSum.constant(5))),
				new Action(Collections.singletonList(new Condition(sum(0, "y", 1), Comparator.EQ)),
						effect("x", WeightedSum.constant(5))),
				new Action(Arrays.asList(
						new Condition(sum(0, "x", 1), Comparator.NE),
						new Condition(sum(0, "y", 1), Comparator.NE)),
						effect()))));
	}

	@Test
	public void guardsSeeEarlierAssignments() {
		List<Action> actions = extract(
				assign(name("x"), num(3)),
				ifS(op("not", op("<=", name("x"), name("y"))),
						block(assign(name("y"), name("x"))),
						Collections.emptyList()));
		assertThat(actions.get(0), is(new Action(
				Collections.singletonList(new Condition(sum(3, "y", -1), Comparator.GT)),
				effect("x", WeightedSum.constant(3), "y", WeightedSum.constant(3)))));
		assertThat(actions.size(), is(2));
	}

	@Test
	public void constantConditionsPrune() {
		List<Action> actions = extract(
				ifS(op(">", num(1), num(2)),
						block(assign(name("x"), num(1))),
						block(assign(name("x"), num(2)))));
		assertThat(actions, is(Collections.singletonList(
				new Action(Collections.emptyList(), effect("x", WeightedSum.constant(2))))));
	}

	@Test
	public void localsStartAtZero() {
		List<Action> actions = extract(Collections.singletonList(intVar("t", 0)),
				augAssign(name("t"), "+", name("x")),
				assign(name("y"), op("+", name("t"), num(1))));
		assertThat(actions, is(Collections.singletonList(new Action(Collections.emptyList(), effect(
				"y", sum(1, "x", 1))))));
	}

	@Test
	public void productOfVariables() {
		TopLevelIssueContext ctx = failing(assign(name("x"), op("*", name("x"), name("y"))));
		assertThat(ctx.getIssues().get(0), instanceOf(NonLinearExpressionIssue.class));
		assertThat(((NonLinearExpressionIssue) ctx.getIssues().get(0)).getReason(), is("product of two variables"));
	}

	@Test
	public void unknownComponent() {
		TopLevelIssueContext ctx = failing(assign(item(name("a"), num(5)), num(0)));
		assertThat(ctx.getIssues().get(0), instanceOf(UnknownStateVariableIssue.class));
	}

	@Test
	public void negativeIndexCountsFromTheEnd() {
		List<Action> actions = extract(assign(item(name("a"), num(-1)), name("x")));
		assertThat(actions, is(Collections.singletonList(new Action(Collections.emptyList(), effect(
				"a[1]", sum(0, "x", 1))))));
	}

	@Test
	public void negativeIndexOutOfRange() {
		TopLevelIssueContext ctx = failing(assign(item(name("a"), num(-3)), num(0)));
		assertThat(ctx.getIssues().get(0), instanceOf(UnknownStateVariableIssue.class));
		assertThat(((UnknownStateVariableIssue) ctx.getIssues().get(0)).getVariable(), is("a[-1]"));
	}

	@Test
	public void indexMustBeConstant() {
		TopLevelIssueContext ctx = failing(assign(item(name("a"), name("x")), num(0)));
		assertThat(ctx.getIssues().get(0), instanceOf(NonLinearExpressionIssue.class));
	}

}
