package daddy.formatters;

import daddy.model.pygmy.*;

import java.io.IOException;
import java.util.List;

public class PygmyStatementFormattingVisitor extends PygmyStatementVisitor<Void, IOException> {

	private final IndentingWriter out;

	public PygmyStatementFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	private void writeBlock(List<PygmyStatement> block) throws IOException {
		try (IndentingWriter.Indent ignored = out.indent()) {
			if (block.isEmpty()) {
				out.newLine();
				out.write("pass");
			}
			for (PygmyStatement statement : block) {
				out.newLine();
				statement.accept(this);
			}
		}
	}

	@Override
	public Void visit(PygmyPass pygmyPass) throws IOException {
		out.write("pass");
		return null;
	}

	@Override
	public Void visit(PygmyAssign pygmyAssign) throws IOException {
		pygmyAssign.getTarget().accept(new PygmyExpressionFormattingVisitor(out));
		out.write(" ");
		if (pygmyAssign.isAugmented()) {
			out.write(pygmyAssign.getOp());
		}
		out.write("= ");
		pygmyAssign.getValue().accept(new PygmyExpressionFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(PygmyIf pygmyIf) throws IOException {
		out.write("if ");
		pygmyIf.getCondition().accept(new PygmyExpressionFormattingVisitor(out));
		out.write(":");
		writeBlock(pygmyIf.getThen());
		if (!pygmyIf.getOrElse().isEmpty()) {
			out.newLine();
			out.write("else:");
			writeBlock(pygmyIf.getOrElse());
		}
		return null;
	}

	@Override
	public Void visit(PygmyFor pygmyFor) throws IOException {
		out.write("for ");
		out.write(pygmyFor.getVariable().getId());
		out.write(" in ");
		pygmyFor.getIterable().accept(new PygmyExpressionFormattingVisitor(out));
		out.write(":");
		writeBlock(pygmyFor.getBody());
		return null;
	}

	@Override
	public Void visit(PygmyReturn pygmyReturn) throws IOException {
		out.write("return");
		if (pygmyReturn.hasValue()) {
			out.write(" ");
			pygmyReturn.getValue().accept(new PygmyExpressionFormattingVisitor(out));
		}
		return null;
	}

	@Override
	public Void visit(PygmyBareCall pygmyBareCall) throws IOException {
		pygmyBareCall.getCall().accept(new PygmyExpressionFormattingVisitor(out));
		return null;
	}

}
