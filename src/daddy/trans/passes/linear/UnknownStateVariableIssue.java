package daddy.trans.passes.linear;

import daddy.errors.Issue;
import daddy.errors.IssueVisitor;
import daddy.model.pygmy.PygmyLookup;

public class UnknownStateVariableIssue extends Issue {

	private final PygmyLookup lookup;
	private final String variable;

	public UnknownStateVariableIssue(PygmyLookup lookup, String variable) {
		this.lookup = lookup;
		this.variable = variable;
	}

	public PygmyLookup getLookup() {
		return lookup;
	}

	public String getVariable() {
		return variable;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
