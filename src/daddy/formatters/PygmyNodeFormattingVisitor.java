package daddy.formatters;

import daddy.model.pygmy.*;

import java.io.IOException;
import java.util.Map;

/**
 * Prints any node back as source. Resolved modules print with their renamed locals, so the output of the
 * inliner can be read (and parsed again) as a plain module.
 */
public class PygmyNodeFormattingVisitor extends PygmyNodeVisitor<Void, IOException> {

	private final IndentingWriter out;

	public PygmyNodeFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(PygmyExpression expression) throws IOException {
		expression.accept(new PygmyExpressionFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(PygmyStatement statement) throws IOException {
		statement.accept(new PygmyStatementFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(PygmyDeclaration declaration) throws IOException {
		declaration.accept(new PygmyDeclarationFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(PygmyGlobal global) throws IOException {
		out.write("global ");
		FormattingTools.writeCommaSeparated(out, global.getNames(), n -> out.write(n.getId()));
		return null;
	}

	@Override
	public Void visit(PygmyUnit unit) throws IOException {
		boolean first = true;
		for (PygmyDeclaration declaration : unit.getDeclarations()) {
			if (!first) {
				out.newLine();
			}
			first = false;
			declaration.accept(this);
		}
		return null;
	}

	@Override
	public Void visit(PygmyVar var) throws IOException {
		out.write(var.getName());
		out.write(": ");
		out.write(var.getType().getName());
		if (var.isArray()) {
			out.write("[");
			out.write(Integer.toString(var.getSize()));
			out.write("]");
		}
		if (var.getInit() != null) {
			out.write(" = ");
			FormattingTools.writeStaticValue(out, var.getInit());
		}
		return null;
	}

	@Override
	public Void visit(PygmyStruct struct) throws IOException {
		out.write("class ");
		out.write(struct.getName());
		if (!struct.getParents().isEmpty()) {
			out.write("(");
			FormattingTools.writeCommaSeparated(out, struct.getParents(), out::write);
			out.write(")");
		}
		out.write(":");
		try (IndentingWriter.Indent ignored = out.indent()) {
			if (struct.getFields().isEmpty()) {
				out.newLine();
				out.write("pass");
			}
			for (PygmyVar field : struct.getFields()) {
				out.newLine();
				field.accept(this);
			}
		}
		return null;
	}

	@Override
	public Void visit(PygmyFunc func) throws IOException {
		out.write("def ");
		out.write(func.getName());
		out.write("(");
		FormattingTools.writeCommaSeparated(out, func.getParams(), out::write);
		out.write("):");
		try (IndentingWriter.Indent ignored = out.indent()) {
			if (!func.getGlobals().isEmpty()) {
				out.newLine();
				out.write("global ");
				FormattingTools.writeCommaSeparated(out, func.getGlobals(), out::write);
			}
			for (PygmyVar local : func.getLocals()) {
				out.newLine();
				local.accept(this);
			}
			if (func.getBody().isEmpty()) {
				out.newLine();
				out.write("pass");
			}
			for (PygmyStatement statement : func.getBody()) {
				out.newLine();
				statement.accept(new PygmyStatementFormattingVisitor(out));
			}
		}
		return null;
	}

	@Override
	public Void visit(PygmyModule module) throws IOException {
		boolean first = true;
		for (Map.Entry<String, Object> constant : module.getConstants().entrySet()) {
			if (!first) {
				out.newLine();
			}
			first = false;
			out.write(constant.getKey());
			out.write(" = ");
			FormattingTools.writeStaticValue(out, constant.getValue());
		}
		for (PygmyStruct struct : module.getStructs().values()) {
			if (!first) {
				out.newLine();
			}
			first = false;
			struct.accept(this);
		}
		for (PygmyVar var : module.getVars().values()) {
			if (!first) {
				out.newLine();
			}
			first = false;
			var.accept(this);
		}
		for (PygmyFunc func : module.getFuncs().values()) {
			if (!first) {
				out.newLine();
			}
			first = false;
			func.accept(this);
		}
		return null;
	}

}
