package daddy.trans.passes.scope;

import daddy.errors.Issue;
import daddy.errors.IssueVisitor;
import daddy.model.pygmy.PygmyCall;

public class UnresolvableCallIssue extends Issue {

	private final PygmyCall call;

	public UnresolvableCallIssue(PygmyCall call) {
		this.call = call;
	}

	public PygmyCall getCall() {
		return call;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
