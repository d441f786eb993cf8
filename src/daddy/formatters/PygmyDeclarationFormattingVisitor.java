package daddy.formatters;

import daddy.model.pygmy.*;

import java.io.IOException;
import java.util.Map;

public class PygmyDeclarationFormattingVisitor extends PygmyDeclarationVisitor<Void, IOException> {

	private final IndentingWriter out;

	public PygmyDeclarationFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(PygmyStaticBinding pygmyStaticBinding) throws IOException {
		out.write(pygmyStaticBinding.getName().getId());
		out.write(" = ");
		pygmyStaticBinding.getValue().accept(new PygmyExpressionFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(PygmyImport pygmyImport) throws IOException {
		if (!pygmyImport.isFromImport()) {
			out.write("import ");
			out.write(pygmyImport.getModule());
			if (pygmyImport.getAlias() != null) {
				out.write(" as ");
				out.write(pygmyImport.getAlias());
			}
			return null;
		}
		out.write("from ");
		out.write(pygmyImport.getModule());
		out.write(" import ");
		boolean first = true;
		for (Map.Entry<String, String> name : pygmyImport.getNames().entrySet()) {
			if (!first) {
				out.write(", ");
			}
			first = false;
			out.write(name.getValue());
			if (!name.getKey().equals(name.getValue())) {
				out.write(" as ");
				out.write(name.getKey());
			}
		}
		return null;
	}

	@Override
	public Void visit(PygmyVarDeclaration pygmyVarDeclaration) throws IOException {
		PygmyExpressionFormattingVisitor expressions = new PygmyExpressionFormattingVisitor(out);
		out.write(pygmyVarDeclaration.getName().getId());
		out.write(": ");
		pygmyVarDeclaration.getType().accept(expressions);
		if (pygmyVarDeclaration.getSize() != null) {
			out.write("[");
			pygmyVarDeclaration.getSize().accept(expressions);
			out.write("]");
		}
		if (pygmyVarDeclaration.getInit() != null) {
			out.write(" = ");
			pygmyVarDeclaration.getInit().accept(expressions);
		}
		return null;
	}

	@Override
	public Void visit(PygmyStructDeclaration pygmyStructDeclaration) throws IOException {
		out.write("class ");
		out.write(pygmyStructDeclaration.getName().getId());
		if (!pygmyStructDeclaration.getParents().isEmpty()) {
			out.write("(");
			FormattingTools.writeCommaSeparated(out, pygmyStructDeclaration.getParents(),
					p -> p.accept(new PygmyExpressionFormattingVisitor(out)));
			out.write(")");
		}
		out.write(":");
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (PygmyVarDeclaration field : pygmyStructDeclaration.getFields()) {
				out.newLine();
				field.accept(this);
			}
		}
		return null;
	}

	@Override
	public Void visit(PygmyFuncDeclaration pygmyFuncDeclaration) throws IOException {
		out.write("def ");
		out.write(pygmyFuncDeclaration.getName().getId());
		out.write("(");
		FormattingTools.writeCommaSeparated(out, pygmyFuncDeclaration.getParams(), p -> out.write(p.getId()));
		out.write("):");
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (PygmyNode item : pygmyFuncDeclaration.getBody()) {
				out.newLine();
				item.accept(new PygmyNodeFormattingVisitor(out));
			}
		}
		return null;
	}

}
