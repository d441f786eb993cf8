package daddy.trans.passes.expansion;

import daddy.errors.Issue;
import daddy.errors.IssueVisitor;
import daddy.model.pygmy.PygmyCall;

public class RecursiveCallIssue extends Issue {

	private final PygmyCall call;
	private final String function;

	public RecursiveCallIssue(PygmyCall call, String function) {
		this.call = call;
		this.function = function;
	}

	public PygmyCall getCall() {
		return call;
	}

	public String getFunction() {
		return function;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
