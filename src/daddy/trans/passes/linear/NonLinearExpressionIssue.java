package daddy.trans.passes.linear;

import daddy.errors.Issue;
import daddy.errors.IssueVisitor;
import daddy.model.pygmy.PygmyExpression;

public class NonLinearExpressionIssue extends Issue {

	private final PygmyExpression expression;
	private final String reason;

	public NonLinearExpressionIssue(PygmyExpression expression, String reason) {
		this.expression = expression;
		this.reason = reason;
	}

	public PygmyExpression getExpression() {
		return expression;
	}

	public String getReason() {
		return reason;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
