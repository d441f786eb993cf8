package daddy.trans.passes.scope;

import daddy.errors.Issue;
import daddy.errors.IssueVisitor;
import daddy.util.SourceLocation;

public class StaticEvaluationIssue extends Issue {

	private final SourceLocation location;
	private final String reason;

	public StaticEvaluationIssue(SourceLocation location, String reason) {
		this.location = location;
		this.reason = reason;
	}

	public SourceLocation getLocation() {
		return location;
	}

	public String getReason() {
		return reason;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
