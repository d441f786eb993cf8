package daddy.trans.passes.expansion;

import daddy.errors.IssueContext;
import daddy.model.pygmy.*;
import daddy.trans.passes.scope.StaticEvaluationException;
import daddy.trans.passes.scope.StaticEvaluationIssue;
import daddy.trans.passes.scope.StaticEvaluator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Expands the body of one function activation: loops are unrolled, decidable conditions select their branch,
 * bound names are substituted and calls are inlined. Returns are kept for the inliner to rewrite.
 */
public class PygmyStatementInliningVisitor extends PygmyStatementVisitor<List<PygmyStatement>, RuntimeException> {

	private final IssueContext ctx;
	private final PygmyFunctionInliner inliner;
	private final Map<String, PygmyExpression> bindings;
	private final PygmyExpressionSubstitutionVisitor expressions;

	public PygmyStatementInliningVisitor(IssueContext ctx, PygmyFunctionInliner inliner,
	                                     Map<String, PygmyExpression> bindings) {
		this.ctx = ctx;
		this.inliner = inliner;
		this.bindings = bindings;
		this.expressions = new PygmyExpressionSubstitutionVisitor(ctx, bindings, inliner.getEnvironment());
	}

	public List<PygmyStatement> expandBlock(List<PygmyStatement> block) {
		List<PygmyStatement> result = new ArrayList<>();
		for (PygmyStatement statement : block) {
			result.addAll(statement.accept(this));
		}
		return result;
	}

	private PygmyLookup substituteTarget(PygmyLookup target) {
		PygmyExpression result = target.accept(expressions);
		if (result instanceof PygmyLookup) {
			return (PygmyLookup) result;
		}
		ctx.error(new StaticEvaluationIssue(target.getLocation(), "cannot assign to a constant"));
		return target;
	}

	private PygmyCall substituteArguments(PygmyCall call) {
		List<PygmyExpression> args = new ArrayList<>();
		for (PygmyExpression arg : call.getArguments()) {
			args.add(arg.accept(expressions));
		}
		return new PygmyCall(call.getLocation(), call.getFunction(), args);
	}

	@Override
	public List<PygmyStatement> visit(PygmyPass pygmyPass) throws RuntimeException {
		return Collections.emptyList();
	}

	@Override
	public List<PygmyStatement> visit(PygmyAssign pygmyAssign) throws RuntimeException {
		PygmyLookup target = substituteTarget(pygmyAssign.getTarget());
		if (PygmyExpressionSubstitutionVisitor.isUserCall(pygmyAssign.getValue())) {
			PygmyCall call = substituteArguments((PygmyCall) pygmyAssign.getValue());
			return inliner.inlineCall(ctx, call, ReturnSite.assign(target, pygmyAssign.getOp()));
		}
		PygmyExpression value = pygmyAssign.getValue().accept(expressions);
		return Collections.singletonList(new PygmyAssign(pygmyAssign.getLocation(), target, value,
				pygmyAssign.getOp()));
	}

	@Override
	public List<PygmyStatement> visit(PygmyIf pygmyIf) throws RuntimeException {
		PygmyExpression condition = pygmyIf.getCondition().accept(expressions);
		if (condition instanceof PygmyConst) {
			return expandBlock(StaticEvaluator.truthy(((PygmyConst) condition).getValue()) ?
					pygmyIf.getThen() : pygmyIf.getOrElse());
		}
		List<PygmyStatement> then = expandBlock(pygmyIf.getThen());
		List<PygmyStatement> orElse = expandBlock(pygmyIf.getOrElse());
		if (then.isEmpty() && orElse.isEmpty()) {
			return Collections.emptyList();
		}
		return Collections.singletonList(new PygmyIf(pygmyIf.getLocation(), condition, then, orElse));
	}

	@Override
	public List<PygmyStatement> visit(PygmyFor pygmyFor) throws RuntimeException {
		PygmyExpression iterable = pygmyFor.getIterable().accept(expressions);
		Object values;
		try {
			values = new StaticEvaluator(inliner.getEnvironment()).evaluate(iterable);
		} catch (StaticEvaluationException e) {
			ctx.error(new StaticEvaluationIssue(pygmyFor.getIterable().getLocation(),
					"a loop must iterate over a compile-time sequence"));
			return Collections.emptyList();
		}
		if (!(values instanceof List)) {
			ctx.error(new StaticEvaluationIssue(pygmyFor.getIterable().getLocation(),
					"cannot iterate over " + StaticEvaluator.describe(values)));
			return Collections.emptyList();
		}
		String variable = pygmyFor.getVariable().getId();
		List<PygmyStatement> result = new ArrayList<>();
		for (Object value : (List<?>) values) {
			if (!StaticEvaluator.isScalar(value)) {
				ctx.error(new StaticEvaluationIssue(pygmyFor.getIterable().getLocation(),
						"loop values must be integers or booleans"));
				break;
			}
			bindings.put(variable, StaticEvaluator.asExpression(pygmyFor.getVariable().getLocation(), value));
			result.addAll(expandBlock(pygmyFor.getBody()));
		}
		bindings.remove(variable);
		return result;
	}

	@Override
	public List<PygmyStatement> visit(PygmyReturn pygmyReturn) throws RuntimeException {
		if (!pygmyReturn.hasValue()) {
			return Collections.singletonList(pygmyReturn);
		}
		PygmyExpression value;
		if (PygmyExpressionSubstitutionVisitor.isUserCall(pygmyReturn.getValue())) {
			ctx.error(new NestedCallIssue((PygmyCall) pygmyReturn.getValue()));
			value = pygmyReturn.getValue();
		} else {
			value = pygmyReturn.getValue().accept(expressions);
		}
		return Collections.singletonList(new PygmyReturn(pygmyReturn.getLocation(), value));
	}

	@Override
	public List<PygmyStatement> visit(PygmyBareCall pygmyBareCall) throws RuntimeException {
		PygmyCall call = pygmyBareCall.getCall();
		if (!PygmyExpressionSubstitutionVisitor.isUserCall(call)) {
			// builtin calls have no effect
			substituteArguments(call);
			return Collections.emptyList();
		}
		return inliner.inlineCall(ctx, substituteArguments(call), ReturnSite.discard());
	}

}
