package daddy.trans.passes.parse;

import daddy.errors.Issue;
import daddy.errors.IssueVisitor;
import daddy.util.SourceLocation;

public class ParsingIssue extends Issue {

	private final SourceLocation location;
	private final String reason;

	public ParsingIssue(SourceLocation location, String reason) {
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
