package daddy.trans.passes.scope;

import daddy.errors.Issue;
import daddy.errors.IssueVisitor;
import daddy.util.SourceLocation;

public class ScopeConflictIssue extends Issue {

	private final String name;
	private final SourceLocation location;
	private final SourceLocation previous;

	public ScopeConflictIssue(String name, SourceLocation location, SourceLocation previous) {
		this.name = name;
		this.location = location;
		this.previous = previous;
	}

	public String getName() {
		return name;
	}

	public SourceLocation getLocation() {
		return location;
	}

	public SourceLocation getPrevious() {
		return previous;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
