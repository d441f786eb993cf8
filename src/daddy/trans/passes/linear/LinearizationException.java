package daddy.trans.passes.linear;

import daddy.errors.Issue;

/**
 * Aborts the extraction of a linear form, carrying the issue to report.
 */
public class LinearizationException extends Exception {

	private final Issue issue;

	public LinearizationException(Issue issue) {
		super(issue.getMessage());
		this.issue = issue;
	}

	public Issue getIssue() {
		return issue;
	}

}
