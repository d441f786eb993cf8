package daddy.trans.passes.linear;

import daddy.model.hom.Comparator;
import daddy.model.pygmy.PygmyConst;
import daddy.model.pygmy.PygmyExpression;
import daddy.model.pygmy.PygmyOp;
import daddy.trans.passes.scope.StaticEvaluator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Turns a condition into disjunctive normal form over linear comparisons: a list of alternatives, each one a
 * list of comparisons that must all hold. No alternative means false, one empty alternative means true.
 * Negations are pushed down to the comparisons, and comparisons that are decided at compile time vanish.
 */
public class ConditionNormalizer {

	private static final List<List<LinearCondition>> TRUE =
			Collections.singletonList(Collections.emptyList());
	private static final List<List<LinearCondition>> FALSE = Collections.emptyList();

	private final LinearFormExtractionVisitor values;

	public ConditionNormalizer(Map<String, LinearForm> env) {
		this.values = new LinearFormExtractionVisitor(env);
	}

	public List<List<LinearCondition>> normalize(PygmyExpression condition) throws LinearizationException {
		return normalize(condition, false);
	}

	public List<List<LinearCondition>> normalize(PygmyExpression condition, boolean negated)
			throws LinearizationException {
		if (condition instanceof PygmyConst) {
			return StaticEvaluator.truthy(((PygmyConst) condition).getValue()) != negated ? TRUE : FALSE;
		}
		if (condition instanceof PygmyOp) {
			PygmyOp op = (PygmyOp) condition;
			switch (op.getOp()) {
				case "not":
					return normalize(op.getChildren().get(0), !negated);
				case "and":
				case "or":
					// De Morgan: a negated conjunction is a disjunction
					boolean conjunction = op.getOp().equals("and") != negated;
					List<List<LinearCondition>> result = conjunction ? TRUE : FALSE;
					for (PygmyExpression child : op.getChildren()) {
						List<List<LinearCondition>> normalized = normalize(child, negated);
						result = conjunction ? product(result, normalized) : union(result, normalized);
					}
					return result;
				default:
					if (op.isComparison()) {
						LinearForm left = op.getChildren().get(0).accept(values);
						LinearForm right = op.getChildren().get(1).accept(values);
						LinearForm difference;
						try {
							difference = left.minus(right);
						} catch (ArithmeticException e) {
							throw new LinearizationException(new NonLinearExpressionIssue(op, "integer overflow"));
						}
						Comparator comparator = Comparator.fromSymbol(op.getOp());
						return atom(new LinearCondition(difference, negated ? comparator.negate() : comparator));
					}
			}
		}
		// any other value is true when non-zero
		LinearForm value = condition.accept(values);
		return atom(new LinearCondition(value, negated ? Comparator.EQ : Comparator.NE));
	}

	private static List<List<LinearCondition>> atom(LinearCondition condition) {
		if (condition.getForm().isConstant()) {
			return condition.getComparator().test(condition.getForm().getConstant()) ? TRUE : FALSE;
		}
		return Collections.singletonList(Collections.singletonList(condition));
	}

	private static List<List<LinearCondition>> union(List<List<LinearCondition>> left,
	                                                 List<List<LinearCondition>> right) {
		List<List<LinearCondition>> result = new ArrayList<>(left);
		for (List<LinearCondition> alternative : right) {
			if (!result.contains(alternative)) {
				result.add(alternative);
			}
		}
		return result;
	}

	private static List<List<LinearCondition>> product(List<List<LinearCondition>> left,
	                                                   List<List<LinearCondition>> right) {
		List<List<LinearCondition>> result = new ArrayList<>();
		for (List<LinearCondition> first : left) {
			for (List<LinearCondition> second : right) {
				List<LinearCondition> alternative = new ArrayList<>(first);
				for (LinearCondition condition : second) {
					if (!alternative.contains(condition)) {
						alternative.add(condition);
					}
				}
				if (!result.contains(alternative)) {
					result.add(alternative);
				}
			}
		}
		return result;
	}

}
