package daddy.errors;

import daddy.trans.UnsupportedFeatureIssue;
import daddy.trans.passes.expansion.*;
import daddy.trans.passes.linear.NonLinearExpressionIssue;
import daddy.trans.passes.linear.UnknownStateVariableIssue;
import daddy.trans.passes.option.OptionParserIssue;
import daddy.trans.passes.parse.IOErrorIssue;
import daddy.trans.passes.parse.ParsingIssue;
import daddy.trans.passes.scope.*;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(IssueWithContext issueWithContext) throws E;
	public abstract T visit(OptionParserIssue optionParserIssue) throws E;
	public abstract T visit(IOErrorIssue ioErrorIssue) throws E;
	public abstract T visit(ParsingIssue parsingIssue) throws E;
	public abstract T visit(UnsupportedFeatureIssue unsupportedFeatureIssue) throws E;
	public abstract T visit(ScopeConflictIssue scopeConflictIssue) throws E;
	public abstract T visit(UndeclaredNameIssue undeclaredNameIssue) throws E;
	public abstract T visit(IllegalAssignmentTargetIssue illegalAssignmentTargetIssue) throws E;
	public abstract T visit(DeclarationOrderIssue declarationOrderIssue) throws E;
	public abstract T visit(StaticEvaluationIssue staticEvaluationIssue) throws E;
	public abstract T visit(UnresolvableCallIssue unresolvableCallIssue) throws E;
	public abstract T visit(RecursiveCallIssue recursiveCallIssue) throws E;
	public abstract T visit(CallArgumentCountMismatchIssue callArgumentCountMismatchIssue) throws E;
	public abstract T visit(NestedCallIssue nestedCallIssue) throws E;
	public abstract T visit(ReturnValueMismatchIssue returnValueMismatchIssue) throws E;
	public abstract T visit(MissingReturnIssue missingReturnIssue) throws E;
	public abstract T visit(UnknownEntryFunctionIssue unknownEntryFunctionIssue) throws E;
	public abstract T visit(NonLinearExpressionIssue nonLinearExpressionIssue) throws E;
	public abstract T visit(UnknownStateVariableIssue unknownStateVariableIssue) throws E;
}
