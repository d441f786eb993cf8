package daddy.trans.passes.scope;

import daddy.errors.IssueContext;
import daddy.model.pygmy.*;
import daddy.util.SourceLocation;

import java.util.ArrayList;
import java.util.List;

public class PygmyStatementScopingVisitor extends PygmyStatementVisitor<PygmyStatement, RuntimeException> {

	private final IssueContext ctx;
	private final FunctionScope scope;
	private final PygmyExpressionScopingVisitor expressions;

	public PygmyStatementScopingVisitor(IssueContext ctx, FunctionScope scope) {
		this.ctx = ctx;
		this.scope = scope;
		this.expressions = new PygmyExpressionScopingVisitor(ctx, scope);
	}

	public List<PygmyStatement> scopeBlock(List<PygmyStatement> block) {
		List<PygmyStatement> result = new ArrayList<>();
		for (PygmyStatement statement : block) {
			result.add(statement.accept(this));
		}
		return result;
	}

	@Override
	public PygmyStatement visit(PygmyPass pygmyPass) throws RuntimeException {
		return pygmyPass;
	}

	@Override
	public PygmyStatement visit(PygmyAssign pygmyAssign) throws RuntimeException {
		switch (scope.classify(pygmyAssign.getTarget().getRoot().getId())) {
			case LOCAL:
			case GLOBAL:
				break;
			case PARAMETER:
				ctx.error(new IllegalAssignmentTargetIssue(pygmyAssign, IllegalAssignmentTargetIssue.Kind.PARAMETER));
				return pygmyAssign;
			case LOOP_VARIABLE:
				ctx.error(new IllegalAssignmentTargetIssue(pygmyAssign,
						IllegalAssignmentTargetIssue.Kind.LOOP_VARIABLE));
				return pygmyAssign;
			case STATIC:
			case FUNCTION:
				ctx.error(new IllegalAssignmentTargetIssue(pygmyAssign, IllegalAssignmentTargetIssue.Kind.CONSTANT));
				return pygmyAssign;
			case MODULE_VARIABLE:
				ctx.error(new IllegalAssignmentTargetIssue(pygmyAssign, IllegalAssignmentTargetIssue.Kind.NOT_GLOBAL));
				return pygmyAssign;
			default:
				ctx.error(new IllegalAssignmentTargetIssue(pygmyAssign,
						IllegalAssignmentTargetIssue.Kind.UNDECLARED));
				return pygmyAssign;
		}
		PygmyExpression target = pygmyAssign.getTarget().accept(expressions);
		PygmyExpression value = pygmyAssign.getValue().accept(expressions);
		if (!(target instanceof PygmyLookup)) {
			return pygmyAssign;
		}
		return new PygmyAssign(pygmyAssign.getLocation(), (PygmyLookup) target, value, pygmyAssign.getOp());
	}

	@Override
	public PygmyStatement visit(PygmyIf pygmyIf) throws RuntimeException {
		PygmyExpression condition = pygmyIf.getCondition().accept(expressions);
		return new PygmyIf(pygmyIf.getLocation(), condition, scopeBlock(pygmyIf.getThen()),
				scopeBlock(pygmyIf.getOrElse()));
	}

	@Override
	public PygmyStatement visit(PygmyFor pygmyFor) throws RuntimeException {
		String variable = pygmyFor.getVariable().getId();
		PygmyExpression iterable = pygmyFor.getIterable().accept(expressions);
		switch (scope.classify(variable)) {
			case LOOP_VARIABLE:
			case PARAMETER:
			case LOCAL:
			case GLOBAL:
			case MODULE_VARIABLE:
			case STATIC:
			case FUNCTION:
				ctx.error(new ScopeConflictIssue(variable, pygmyFor.getVariable().getLocation(),
						SourceLocation.unknown()));
				return pygmyFor;
			default:
				break;
		}
		scope.enterLoop(variable);
		List<PygmyStatement> body = scopeBlock(pygmyFor.getBody());
		scope.exitLoop(variable);
		return new PygmyFor(pygmyFor.getLocation(), pygmyFor.getVariable(), iterable, body);
	}

	@Override
	public PygmyStatement visit(PygmyReturn pygmyReturn) throws RuntimeException {
		if (!pygmyReturn.hasValue()) {
			return pygmyReturn;
		}
		return new PygmyReturn(pygmyReturn.getLocation(), pygmyReturn.getValue().accept(expressions));
	}

	@Override
	public PygmyStatement visit(PygmyBareCall pygmyBareCall) throws RuntimeException {
		PygmyExpression call = pygmyBareCall.getCall().accept(expressions);
		if (!(call instanceof PygmyCall)) {
			return pygmyBareCall;
		}
		return new PygmyBareCall(pygmyBareCall.getLocation(), (PygmyCall) call);
	}

}
