package daddy.trans.passes.expansion;

import daddy.errors.IssueContext;
import daddy.model.pygmy.*;
import daddy.trans.passes.scope.StaticEvaluationException;
import daddy.trans.passes.scope.StaticEvaluationIssue;
import daddy.trans.passes.scope.StaticEvaluator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Replaces bound names (parameters, loop variables, locals) by their bindings and folds every subexpression whose
 * names are all compile-time constants. Calls to user functions are only allowed at the top of a statement, so
 * any call reaching this visitor is reported.
 */
public class PygmyExpressionSubstitutionVisitor extends PygmyExpressionVisitor<PygmyExpression, RuntimeException> {

	private final IssueContext ctx;
	private final Map<String, PygmyExpression> bindings;
	private final Map<String, Object> env;

	public PygmyExpressionSubstitutionVisitor(IssueContext ctx, Map<String, PygmyExpression> bindings,
	                                          Map<String, Object> env) {
		this.ctx = ctx;
		this.bindings = bindings;
		this.env = env;
	}

	public static boolean isUserCall(PygmyExpression expression) {
		return expression instanceof PygmyCall && ((PygmyCall) expression).getFunction() instanceof PygmyName;
	}

	private boolean isFoldable(PygmyExpression expression) {
		if (expression instanceof PygmyConst) {
			return true;
		} else if (expression instanceof PygmyName) {
			return env.containsKey(((PygmyName) expression).getId());
		} else if (expression instanceof PygmyAttr) {
			return isFoldable(((PygmyAttr) expression).getValue());
		} else if (expression instanceof PygmyItem) {
			return isFoldable(((PygmyItem) expression).getValue()) && isFoldable(((PygmyItem) expression).getItem());
		} else if (expression instanceof PygmyOp) {
			return ((PygmyOp) expression).getChildren().stream().allMatch(this::isFoldable);
		} else if (expression instanceof PygmyCall) {
			return !isUserCall(expression) && isFoldable(((PygmyCall) expression).getFunction()) &&
					((PygmyCall) expression).getArguments().stream().allMatch(this::isFoldable);
		} else if (expression instanceof PygmySequence) {
			return ((PygmySequence) expression).getElements().stream().allMatch(this::isFoldable);
		}
		return false;
	}

	private PygmyExpression fold(PygmyExpression expression) {
		if (!isFoldable(expression)) {
			return expression;
		}
		try {
			Object value = new StaticEvaluator(env).evaluate(expression);
			if (StaticEvaluator.isScalar(value)) {
				return StaticEvaluator.asExpression(expression.getLocation(), value);
			}
		} catch (StaticEvaluationException e) {
			ctx.error(e.toIssue());
		}
		return expression;
	}

	private PygmyLookup substituteLookup(PygmyLookup lookup) {
		PygmyExpression result = lookup.accept(this);
		if (result instanceof PygmyLookup) {
			return (PygmyLookup) result;
		}
		ctx.error(new StaticEvaluationIssue(lookup.getLocation(), "a constant cannot be indexed or have attributes"));
		return lookup;
	}

	@Override
	public PygmyExpression visit(PygmyConst pygmyConst) throws RuntimeException {
		return pygmyConst;
	}

	@Override
	public PygmyExpression visit(PygmyName pygmyName) throws RuntimeException {
		return bindings.getOrDefault(pygmyName.getId(), pygmyName);
	}

	@Override
	public PygmyExpression visit(PygmyAttr pygmyAttr) throws RuntimeException {
		return fold(new PygmyAttr(pygmyAttr.getLocation(), substituteLookup(pygmyAttr.getValue()), pygmyAttr.getAttr()));
	}

	@Override
	public PygmyExpression visit(PygmyItem pygmyItem) throws RuntimeException {
		return fold(new PygmyItem(pygmyItem.getLocation(), substituteLookup(pygmyItem.getValue()),
				pygmyItem.getItem().accept(this)));
	}

	@Override
	public PygmyExpression visit(PygmyOp pygmyOp) throws RuntimeException {
		List<PygmyExpression> children = new ArrayList<>();
		for (PygmyExpression child : pygmyOp.getChildren()) {
			children.add(child.accept(this));
		}
		String op = pygmyOp.getOp();
		if (op.equals("and") || op.equals("or")) {
			// a constant operand either decides the whole expression or can be dropped
			boolean absorbing = op.equals("or");
			List<PygmyExpression> remaining = new ArrayList<>();
			for (PygmyExpression child : children) {
				if (child instanceof PygmyConst) {
					if (StaticEvaluator.truthy(((PygmyConst) child).getValue()) == absorbing) {
						return new PygmyConst(pygmyOp.getLocation(), absorbing);
					}
				} else {
					remaining.add(child);
				}
			}
			if (remaining.isEmpty()) {
				return new PygmyConst(pygmyOp.getLocation(), !absorbing);
			}
			if (remaining.size() == 1) {
				return remaining.get(0);
			}
			return new PygmyOp(pygmyOp.getLocation(), op, remaining);
		}
		return fold(new PygmyOp(pygmyOp.getLocation(), op, children));
	}

	@Override
	public PygmyExpression visit(PygmyCall pygmyCall) throws RuntimeException {
		if (isUserCall(pygmyCall)) {
			ctx.error(new NestedCallIssue(pygmyCall));
			return pygmyCall;
		}
		List<PygmyExpression> args = new ArrayList<>();
		for (PygmyExpression arg : pygmyCall.getArguments()) {
			args.add(arg.accept(this));
		}
		return fold(new PygmyCall(pygmyCall.getLocation(), pygmyCall.getFunction(), args));
	}

	@Override
	public PygmyExpression visit(PygmySequence pygmySequence) throws RuntimeException {
		List<PygmyExpression> elements = new ArrayList<>();
		for (PygmyExpression element : pygmySequence.getElements()) {
			elements.add(element.accept(this));
		}
		return new PygmySequence(pygmySequence.getLocation(), elements);
	}

}
