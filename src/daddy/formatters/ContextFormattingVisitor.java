package daddy.formatters;

import daddy.errors.ContextVisitor;
import daddy.trans.passes.expansion.InliningCall;

import java.io.IOException;

public class ContextFormattingVisitor extends ContextVisitor<Void, IOException> {

	private final IndentingWriter out;

	public ContextFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(InliningCall inliningCall) throws IOException {
		out.write("while inlining call to '");
		out.write(inliningCall.getFunction());
		out.write("' at line ");
		out.write(Integer.toString(inliningCall.getCall().getLocation().getStartLine()));
		out.write(" column ");
		out.write(Integer.toString(inliningCall.getCall().getLocation().getStartColumn() + 1));
		return null;
	}

}
