package daddy.formatters;

import daddy.model.pygmy.*;

import java.io.IOException;

public class PygmyExpressionFormattingVisitor extends PygmyExpressionVisitor<Void, IOException> {

	private final IndentingWriter out;

	public PygmyExpressionFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	private void writeOperand(PygmyExpression operand) throws IOException {
		if (operand instanceof PygmyOp) {
			out.write("(");
			operand.accept(this);
			out.write(")");
		} else {
			operand.accept(this);
		}
	}

	@Override
	public Void visit(PygmyConst pygmyConst) throws IOException {
		FormattingTools.writeStaticValue(out, pygmyConst.getValue());
		return null;
	}

	@Override
	public Void visit(PygmyName pygmyName) throws IOException {
		out.write(pygmyName.getId());
		return null;
	}

	@Override
	public Void visit(PygmyAttr pygmyAttr) throws IOException {
		pygmyAttr.getValue().accept(this);
		out.write(".");
		out.write(pygmyAttr.getAttr());
		return null;
	}

	@Override
	public Void visit(PygmyItem pygmyItem) throws IOException {
		pygmyItem.getValue().accept(this);
		out.write("[");
		pygmyItem.getItem().accept(this);
		out.write("]");
		return null;
	}

	@Override
	public Void visit(PygmyOp pygmyOp) throws IOException {
		if (pygmyOp.getChildren().size() == 1) {
			out.write(pygmyOp.getOp());
			if (pygmyOp.getOp().equals("not")) {
				out.write(" ");
			}
			writeOperand(pygmyOp.getChildren().get(0));
			return null;
		}
		boolean first = true;
		for (PygmyExpression child : pygmyOp.getChildren()) {
			if (!first) {
				out.write(" ");
				out.write(pygmyOp.getOp());
				out.write(" ");
			}
			first = false;
			writeOperand(child);
		}
		return null;
	}

	@Override
	public Void visit(PygmyCall pygmyCall) throws IOException {
		pygmyCall.getFunction().accept(this);
		out.write("(");
		FormattingTools.writeCommaSeparated(out, pygmyCall.getArguments(), a -> a.accept(this));
		out.write(")");
		return null;
	}

	@Override
	public Void visit(PygmySequence pygmySequence) throws IOException {
		out.write("[");
		FormattingTools.writeCommaSeparated(out, pygmySequence.getElements(), e -> e.accept(this));
		out.write("]");
		return null;
	}

}
