package daddy.trans.passes.scope;

import daddy.errors.Issue;
import daddy.errors.IssueVisitor;
import daddy.model.pygmy.PygmyName;

public class UndeclaredNameIssue extends Issue {

	private final PygmyName name;

	public UndeclaredNameIssue(PygmyName name) {
		this.name = name;
	}

	public PygmyName getName() {
		return name;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
