package daddy.trans.passes.expansion;

import daddy.errors.Issue;
import daddy.errors.IssueVisitor;
import daddy.model.pygmy.PygmyCall;
import daddy.model.pygmy.PygmyFunc;

public class CallArgumentCountMismatchIssue extends Issue {

	private final PygmyCall call;
	private final PygmyFunc func;

	public CallArgumentCountMismatchIssue(PygmyCall call, PygmyFunc func) {
		this.call = call;
		this.func = func;
	}

	public PygmyCall getCall() {
		return call;
	}

	public PygmyFunc getFunc() {
		return func;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
