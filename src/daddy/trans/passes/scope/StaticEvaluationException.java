package daddy.trans.passes.scope;

import daddy.util.SourceLocation;

public class StaticEvaluationException extends Exception {

	private final SourceLocation location;
	private final String reason;

	public StaticEvaluationException(SourceLocation location, String reason) {
		super(reason);
		this.location = location;
		this.reason = reason;
	}

	public SourceLocation getLocation() {
		return location;
	}

	public String getReason() {
		return reason;
	}

	public StaticEvaluationIssue toIssue() {
		return new StaticEvaluationIssue(location, reason);
	}
}
