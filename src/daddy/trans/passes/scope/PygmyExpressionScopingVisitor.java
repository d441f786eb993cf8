package daddy.trans.passes.scope;

import daddy.errors.IssueContext;
import daddy.model.pygmy.*;
import daddy.trans.UnsupportedFeatureIssue;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites an expression of a function body so that it only mentions parameters, loop variables, declared
 * globals, renamed locals, sequence constants and functions. Scalar constants are substituted, and builtin
 * functions are called through the {@code pygmy} module.
 *
 * Problems are reported to the issue context and the offending expression is kept as it was.
 */
public class PygmyExpressionScopingVisitor extends PygmyExpressionVisitor<PygmyExpression, RuntimeException> {

	private final IssueContext ctx;
	private final FunctionScope scope;

	public PygmyExpressionScopingVisitor(IssueContext ctx, FunctionScope scope) {
		this.ctx = ctx;
		this.scope = scope;
	}

	private boolean hasStaticRoot(PygmyLookup lookup) {
		return scope.classify(lookup.getRoot().getId()) == NameKind.STATIC;
	}

	@Override
	public PygmyExpression visit(PygmyConst pygmyConst) throws RuntimeException {
		return pygmyConst;
	}

	@Override
	public PygmyExpression visit(PygmyName pygmyName) throws RuntimeException {
		String id = pygmyName.getId();
		switch (scope.classify(id)) {
			case LOOP_VARIABLE:
			case PARAMETER:
			case GLOBAL:
			case MODULE_VARIABLE:
				return pygmyName;
			case LOCAL:
				return new PygmyName(pygmyName.getLocation(), scope.getRenamedLocal(id));
			case STATIC: {
				Object value = scope.getStatics().get(id);
				if (StaticEvaluator.isScalar(value)) {
					return StaticEvaluator.asExpression(pygmyName.getLocation(), value);
				} else if (StaticEvaluator.isData(value)) {
					// sequences stay module constants, indexed once loops are unrolled
					return pygmyName;
				}
				ctx.error(new StaticEvaluationIssue(pygmyName.getLocation(),
						StaticEvaluator.describe(value) + " cannot be used as a value"));
				return pygmyName;
			}
			case FUNCTION:
				ctx.error(new UnsupportedFeatureIssue(pygmyName.getLocation(), "use of function '" + id + "' as a value"));
				return pygmyName;
			default:
				ctx.error(new UndeclaredNameIssue(pygmyName));
				return pygmyName;
		}
	}

	private PygmyExpression foldStaticLookup(PygmyLookup lookup) {
		try {
			Object value = new StaticEvaluator(scope.getStatics()).evaluate(lookup);
			if (StaticEvaluator.isData(value)) {
				return StaticEvaluator.asExpression(lookup.getLocation(), value);
			}
			ctx.error(new StaticEvaluationIssue(lookup.getLocation(),
					StaticEvaluator.describe(value) + " cannot be used as a value"));
		} catch (StaticEvaluationException e) {
			ctx.error(e.toIssue());
		}
		return lookup;
	}

	private PygmyExpression resolveLookupValue(PygmyLookup value) {
		PygmyExpression resolved = value.accept(this);
		if (!(resolved instanceof PygmyLookup)) {
			ctx.error(new StaticEvaluationIssue(value.getLocation(), "'" + value + "' is not a variable"));
			return null;
		}
		return resolved;
	}

	/**
	 * @return whether every name in the expression is a compile-time constant
	 */
	private boolean isStatic(PygmyExpression expression) {
		if (expression instanceof PygmyName) {
			return scope.classify(((PygmyName) expression).getId()) == NameKind.STATIC;
		} else if (expression instanceof PygmyAttr) {
			return isStatic(((PygmyAttr) expression).getValue());
		} else if (expression instanceof PygmyItem) {
			return isStatic(((PygmyItem) expression).getValue()) && isStatic(((PygmyItem) expression).getItem());
		} else if (expression instanceof PygmyOp) {
			return ((PygmyOp) expression).getChildren().stream().allMatch(this::isStatic);
		} else if (expression instanceof PygmyCall) {
			return isStatic(((PygmyCall) expression).getFunction()) &&
					((PygmyCall) expression).getArguments().stream().allMatch(this::isStatic);
		} else if (expression instanceof PygmySequence) {
			return ((PygmySequence) expression).getElements().stream().allMatch(this::isStatic);
		}
		return expression instanceof PygmyConst;
	}

	@Override
	public PygmyExpression visit(PygmyAttr pygmyAttr) throws RuntimeException {
		if (hasStaticRoot(pygmyAttr)) {
			return foldStaticLookup(pygmyAttr);
		}
		PygmyExpression value = resolveLookupValue(pygmyAttr.getValue());
		if (value == null) {
			return pygmyAttr;
		}
		return new PygmyAttr(pygmyAttr.getLocation(), (PygmyLookup) value, pygmyAttr.getAttr());
	}

	@Override
	public PygmyExpression visit(PygmyItem pygmyItem) throws RuntimeException {
		if (isStatic(pygmyItem)) {
			return foldStaticLookup(pygmyItem);
		}
		// the index is only known once loops are unrolled, so a sequence constant stays indexed by name
		PygmyExpression item = pygmyItem.getItem().accept(this);
		PygmyExpression value = resolveLookupValue(pygmyItem.getValue());
		if (value == null) {
			return pygmyItem;
		}
		return new PygmyItem(pygmyItem.getLocation(), (PygmyLookup) value, item);
	}

	@Override
	public PygmyExpression visit(PygmyOp pygmyOp) throws RuntimeException {
		List<PygmyExpression> children = new ArrayList<>();
		for (PygmyExpression child : pygmyOp.getChildren()) {
			children.add(child.accept(this));
		}
		return new PygmyOp(pygmyOp.getLocation(), pygmyOp.getOp(), children);
	}

	@Override
	public PygmyExpression visit(PygmyCall pygmyCall) throws RuntimeException {
		List<PygmyExpression> args = new ArrayList<>();
		for (PygmyExpression arg : pygmyCall.getArguments()) {
			args.add(arg.accept(this));
		}
		PygmyLookup function = pygmyCall.getFunction();
		if (function instanceof PygmyName && scope.classify(((PygmyName) function).getId()) == NameKind.FUNCTION) {
			return new PygmyCall(pygmyCall.getLocation(), function, args);
		}
		if (hasStaticRoot(function)) {
			try {
				Object value = new StaticEvaluator(scope.getStatics()).evaluate(function);
				String export = PygmyBuiltinModule.INSTANCE.exportName(value);
				if (export != null && !(value instanceof PygmyType && ((PygmyType) value).isStruct())) {
					PygmyAttr builtin = new PygmyAttr(function.getLocation(),
							new PygmyName(function.getLocation(), PygmyBuiltinModule.NAME), export);
					return new PygmyCall(pygmyCall.getLocation(), builtin, args);
				}
			} catch (StaticEvaluationException e) {
				ctx.error(e.toIssue());
				return pygmyCall;
			}
			ctx.error(new UnresolvableCallIssue(pygmyCall));
			return pygmyCall;
		}
		NameKind kind = scope.classify(function.getRoot().getId());
		if (kind == NameKind.UNDECLARED) {
			ctx.error(new UndeclaredNameIssue(function.getRoot()));
		} else {
			ctx.error(new UnresolvableCallIssue(pygmyCall));
		}
		return pygmyCall;
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
