package daddy.trans.passes.expansion;

import daddy.errors.Issue;
import daddy.errors.IssueVisitor;
import daddy.model.pygmy.PygmyReturn;

public class ReturnValueMismatchIssue extends Issue {

	private final PygmyReturn returnStatement;
	private final String function;
	private final boolean valueExpected;

	public ReturnValueMismatchIssue(PygmyReturn returnStatement, String function, boolean valueExpected) {
		this.returnStatement = returnStatement;
		this.function = function;
		this.valueExpected = valueExpected;
	}

	public PygmyReturn getReturnStatement() {
		return returnStatement;
	}

	public String getFunction() {
		return function;
	}

	public boolean isValueExpected() {
		return valueExpected;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
