package daddy.trans.passes.scope;

import daddy.errors.Issue;
import daddy.errors.IssueVisitor;
import daddy.model.pygmy.PygmyAssign;

public class IllegalAssignmentTargetIssue extends Issue {

	public enum Kind {
		PARAMETER("parameter"),
		LOOP_VARIABLE("loop variable"),
		CONSTANT("constant"),
		NOT_GLOBAL("module variable not declared global"),
		UNDECLARED("undeclared name");

		private final String description;

		Kind(String description) {
			this.description = description;
		}

		public String getDescription() {
			return description;
		}
	}

	private final PygmyAssign assign;
	private final Kind kind;

	public IllegalAssignmentTargetIssue(PygmyAssign assign, Kind kind) {
		this.assign = assign;
		this.kind = kind;
	}

	public PygmyAssign getAssign() {
		return assign;
	}

	public Kind getKind() {
		return kind;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
