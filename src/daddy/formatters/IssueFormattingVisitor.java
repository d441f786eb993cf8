package daddy.formatters;

import daddy.errors.IssueVisitor;
import daddy.errors.IssueWithContext;
import daddy.trans.UnsupportedFeatureIssue;
import daddy.trans.passes.expansion.*;
import daddy.trans.passes.linear.NonLinearExpressionIssue;
import daddy.trans.passes.linear.UnknownStateVariableIssue;
import daddy.trans.passes.option.OptionParserIssue;
import daddy.trans.passes.parse.IOErrorIssue;
import daddy.trans.passes.parse.ParsingIssue;
import daddy.trans.passes.scope.*;
import daddy.util.SourceLocation;

import java.io.IOException;

/**
 * Located issues print the position and the source line, then a caret under the offending column followed by
 * the message.
 */
public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {

	private final IndentingWriter out;

	public IssueFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	private void writeLocated(SourceLocation location, String message) throws IOException {
		if (location.isUnknown()) {
			out.write(message);
			return;
		}
		location.writePretty(out);
		out.write(" ");
		out.write(message);
	}

	@Override
	public Void visit(IssueWithContext issueWithContext) throws IOException {
		issueWithContext.getContext().accept(new ContextFormattingVisitor(out));
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			issueWithContext.getIssue().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(OptionParserIssue optionParserIssue) throws IOException {
		out.write("unable to parse options: ");
		out.write(optionParserIssue.getReason());
		return null;
	}

	@Override
	public Void visit(IOErrorIssue ioErrorIssue) throws IOException {
		out.write("IO Error: ");
		out.write(ioErrorIssue.getError().toString());
		return null;
	}

	@Override
	public Void visit(ParsingIssue parsingIssue) throws IOException {
		writeLocated(parsingIssue.getLocation(), parsingIssue.getReason());
		return null;
	}

	@Override
	public Void visit(UnsupportedFeatureIssue unsupportedFeatureIssue) throws IOException {
		writeLocated(unsupportedFeatureIssue.getLocation(), "unsupported " + unsupportedFeatureIssue.getFeature());
		return null;
	}

	@Override
	public Void visit(ScopeConflictIssue scopeConflictIssue) throws IOException {
		String message = "'" + scopeConflictIssue.getName() + "' is already declared";
		SourceLocation previous = scopeConflictIssue.getPrevious();
		if (!previous.isUnknown()) {
			message += " at line " + previous.getStartLine() + " column " + (previous.getStartColumn() + 1);
		}
		writeLocated(scopeConflictIssue.getLocation(), message);
		return null;
	}

	@Override
	public Void visit(UndeclaredNameIssue undeclaredNameIssue) throws IOException {
		writeLocated(undeclaredNameIssue.getName().getLocation(),
				"undeclared name '" + undeclaredNameIssue.getName().getId() + "'");
		return null;
	}

	@Override
	public Void visit(IllegalAssignmentTargetIssue illegalAssignmentTargetIssue) throws IOException {
		writeLocated(illegalAssignmentTargetIssue.getAssign().getLocation(),
				"cannot assign to " + illegalAssignmentTargetIssue.getKind().getDescription() + " '" +
						illegalAssignmentTargetIssue.getAssign().getTarget().getRoot().getId() + "'");
		return null;
	}

	@Override
	public Void visit(DeclarationOrderIssue declarationOrderIssue) throws IOException {
		writeLocated(declarationOrderIssue.getItem().getLocation(),
				"declaration must come before " + declarationOrderIssue.getExpectedBefore());
		return null;
	}

	@Override
	public Void visit(StaticEvaluationIssue staticEvaluationIssue) throws IOException {
		writeLocated(staticEvaluationIssue.getLocation(),
				"cannot evaluate at compile time: " + staticEvaluationIssue.getReason());
		return null;
	}

	@Override
	public Void visit(UnresolvableCallIssue unresolvableCallIssue) throws IOException {
		writeLocated(unresolvableCallIssue.getCall().getLocation(),
				"'" + unresolvableCallIssue.getCall().getFunction() + "' is not a function");
		return null;
	}

	@Override
	public Void visit(RecursiveCallIssue recursiveCallIssue) throws IOException {
		writeLocated(recursiveCallIssue.getCall().getLocation(),
				"recursive call to '" + recursiveCallIssue.getFunction() + "'");
		return null;
	}

	@Override
	public Void visit(CallArgumentCountMismatchIssue callArgumentCountMismatchIssue) throws IOException {
		writeLocated(callArgumentCountMismatchIssue.getCall().getLocation(),
				"function '" + callArgumentCountMismatchIssue.getFunc().getName() + "' expects " +
						callArgumentCountMismatchIssue.getFunc().getParams().size() + " argument(s) but got " +
						callArgumentCountMismatchIssue.getCall().getArguments().size());
		return null;
	}

	@Override
	public Void visit(NestedCallIssue nestedCallIssue) throws IOException {
		writeLocated(nestedCallIssue.getCall().getLocation(),
				"calls are only supported as statements or as the whole right-hand side of an assignment");
		return null;
	}

	@Override
	public Void visit(ReturnValueMismatchIssue returnValueMismatchIssue) throws IOException {
		if (returnValueMismatchIssue.isValueExpected()) {
			writeLocated(returnValueMismatchIssue.getReturnStatement().getLocation(),
					"function '" + returnValueMismatchIssue.getFunction() + "' returns no value where one is expected");
		} else {
			writeLocated(returnValueMismatchIssue.getReturnStatement().getLocation(),
					"function '" + returnValueMismatchIssue.getFunction() + "' returns a value where none is expected");
		}
		return null;
	}

	@Override
	public Void visit(MissingReturnIssue missingReturnIssue) throws IOException {
		writeLocated(missingReturnIssue.getFunc().getLocation(),
				"function '" + missingReturnIssue.getFunc().getName() + "' does not return a value on every path");
		return null;
	}

	@Override
	public Void visit(UnknownEntryFunctionIssue unknownEntryFunctionIssue) throws IOException {
		out.write("no function named '");
		out.write(unknownEntryFunctionIssue.getName());
		out.write("' to use as an entry point");
		return null;
	}

	@Override
	public Void visit(NonLinearExpressionIssue nonLinearExpressionIssue) throws IOException {
		writeLocated(nonLinearExpressionIssue.getExpression().getLocation(),
				"non-linear expression: " + nonLinearExpressionIssue.getReason());
		return null;
	}

	@Override
	public Void visit(UnknownStateVariableIssue unknownStateVariableIssue) throws IOException {
		writeLocated(unknownStateVariableIssue.getLookup().getLocation(),
				"unknown state variable '" + unknownStateVariableIssue.getVariable() + "'");
		return null;
	}

}
