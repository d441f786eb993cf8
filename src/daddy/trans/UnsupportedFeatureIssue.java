package daddy.trans;

import daddy.errors.Issue;
import daddy.errors.IssueVisitor;
import daddy.util.SourceLocation;

public class UnsupportedFeatureIssue extends Issue {

	private final SourceLocation location;
	private final String feature;

	public UnsupportedFeatureIssue(SourceLocation location, String feature) {
		this.location = location;
		this.feature = feature;
	}

	public SourceLocation getLocation() {
		return location;
	}

	public String getFeature() {
		return feature;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
