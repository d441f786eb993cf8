package daddy.trans.passes.linear;

import daddy.InternalCompilerError;
import daddy.errors.IssueContext;
import daddy.model.ddd.VariableOrder;
import daddy.model.hom.Action;
import daddy.model.hom.Condition;
import daddy.model.hom.WeightedSum;
import daddy.model.pygmy.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Symbolically executes a flat function body. Each way through its conditionals becomes one {@link Action}
 * whose guard and effect only mention the state before the call, so it can be applied in a single walk.
 */
public class ActionExtractionPass {
	private ActionExtractionPass() {}

	private static final class Branch {
		final List<LinearCondition> guard;
		final Map<String, LinearForm> env;

		Branch(List<LinearCondition> guard, Map<String, LinearForm> env) {
			this.guard = guard;
			this.env = env;
		}
	}

	private static List<Branch> execute(List<PygmyStatement> block, List<Branch> branches)
			throws LinearizationException {
		List<Branch> current = branches;
		for (PygmyStatement statement : block) {
			List<Branch> next = new ArrayList<>();
			for (Branch branch : current) {
				next.addAll(execute(statement, branch));
			}
			current = next;
		}
		return current;
	}

	private static List<Branch> execute(PygmyStatement statement, Branch branch) throws LinearizationException {
		if (statement instanceof PygmyPass) {
			return Collections.singletonList(branch);
		} else if (statement instanceof PygmyAssign) {
			PygmyAssign assign = (PygmyAssign) statement;
			String target = LinearFormExtractionVisitor.resolve(branch.env, assign.getTarget());
			LinearForm value = assign.getValue().accept(new LinearFormExtractionVisitor(branch.env));
			try {
				if ("+".equals(assign.getOp())) {
					value = branch.env.get(target).plus(value);
				} else if ("-".equals(assign.getOp())) {
					value = branch.env.get(target).minus(value);
				}
			} catch (ArithmeticException e) {
				throw new LinearizationException(new NonLinearExpressionIssue(assign.getValue(), "integer overflow"));
			}
			Map<String, LinearForm> env = new LinkedHashMap<>(branch.env);
			env.put(target, value);
			return Collections.singletonList(new Branch(branch.guard, env));
		} else if (statement instanceof PygmyIf) {
			PygmyIf pygmyIf = (PygmyIf) statement;
			ConditionNormalizer normalizer = new ConditionNormalizer(branch.env);
			List<Branch> result = new ArrayList<>();
			for (List<LinearCondition> alternative : normalizer.normalize(pygmyIf.getCondition())) {
				result.addAll(execute(pygmyIf.getThen(), Collections.singletonList(refine(branch, alternative))));
			}
			for (List<LinearCondition> alternative : normalizer.normalize(pygmyIf.getCondition(), true)) {
				result.addAll(execute(pygmyIf.getOrElse(), Collections.singletonList(refine(branch, alternative))));
			}
			return result;
		}
		throw new InternalCompilerError("statement left in a flat body: " + statement.getClass().getSimpleName());
	}

	private static Branch refine(Branch branch, List<LinearCondition> conditions) {
		List<LinearCondition> guard = new ArrayList<>(branch.guard);
		for (LinearCondition condition : conditions) {
			if (!guard.contains(condition)) {
				guard.add(condition);
			}
		}
		return new Branch(guard, branch.env);
	}

	private static void addLocal(PygmyVar local, Map<String, LinearForm> env) {
		if (local.isArray()) {
			for (int i = 0; i < local.getSize(); i++) {
				env.put(local.getName() + "[" + i + "]", LinearForm.constant(0));
			}
		} else {
			env.put(local.getName(), LinearForm.constant(0));
		}
	}

	public static List<Action> perform(IssueContext ctx, VariableOrder order, PygmyFunc func) {
		Map<String, LinearForm> env = new LinkedHashMap<>();
		for (String variable : order.getVariables()) {
			env.put(variable, LinearForm.variable(variable));
		}
		for (PygmyVar local : func.getLocals()) {
			addLocal(local, env);
		}
		List<Branch> branches;
		try {
			branches = execute(func.getBody(), Collections.singletonList(new Branch(Collections.emptyList(), env)));
		} catch (LinearizationException e) {
			ctx.error(e.getIssue());
			return Collections.emptyList();
		}
		List<Action> actions = new ArrayList<>();
		for (Branch branch : branches) {
			List<Condition> guard = new ArrayList<>();
			for (LinearCondition condition : branch.guard) {
				guard.add(condition.toCondition(order));
			}
			Map<String, WeightedSum> effect = new LinkedHashMap<>();
			for (String variable : order.getVariables()) {
				LinearForm value = branch.env.get(variable);
				if (!value.equals(LinearForm.variable(variable))) {
					effect.put(variable, value.toWeightedSum(order));
				}
			}
			actions.add(new Action(guard, effect));
		}
		return actions;
	}
}
