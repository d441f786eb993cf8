package daddy.trans.passes.expansion;

import daddy.errors.Issue;
import daddy.errors.IssueVisitor;
import daddy.model.pygmy.PygmyFunc;

public class MissingReturnIssue extends Issue {

	private final PygmyFunc func;

	public MissingReturnIssue(PygmyFunc func) {
		this.func = func;
	}

	public PygmyFunc getFunc() {
		return func;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
