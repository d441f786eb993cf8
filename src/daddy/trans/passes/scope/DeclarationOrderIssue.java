package daddy.trans.passes.scope;

import daddy.errors.Issue;
import daddy.errors.IssueVisitor;
import daddy.model.pygmy.PygmyNode;

/**
 * A global line after local declarations or statements, or a local declaration after statements.
 */
public class DeclarationOrderIssue extends Issue {

	private final PygmyNode item;
	private final String expectedBefore;

	public DeclarationOrderIssue(PygmyNode item, String expectedBefore) {
		this.item = item;
		this.expectedBefore = expectedBefore;
	}

	public PygmyNode getItem() {
		return item;
	}

	public String getExpectedBefore() {
		return expectedBefore;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
