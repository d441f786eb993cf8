package daddy.parser;

import daddy.lexer.PygmyToken;
import daddy.lexer.PygmyTokenType;
import daddy.model.pygmy.*;
import daddy.util.SourceLocation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recursive descent parser from a token stream to a {@link PygmyUnit}.
 *
 * The accepted language is a small subset of the host language. Anything outside it is rejected on the first
 * occurrence, at the position of the offending construct.
 */
public class PygmyParser {

	private static final List<String> COMPARISON_OPS = Arrays.asList("==", "!=", "<", "<=", ">", ">=");
	private static final List<String> UNSUPPORTED_BINOPS = Arrays.asList("/", "//", "%", "@", "**", "<<", ">>",
			"&", "|", "^");
	private static final List<String> UNSUPPORTED_AUGOPS = Arrays.asList("*=", "/=", "//=", "%=", "**=", "@=",
			"&=", "|=", "^=", "<<=", ">>=");

	private final List<PygmyToken> tokens;
	private int pos;

	public PygmyParser(List<PygmyToken> tokens) {
		this.tokens = tokens;
		this.pos = 0;
	}

	private PygmyToken peek() {
		return tokens.get(pos);
	}

	private PygmyToken peek(int ahead) {
		return tokens.get(Math.min(pos + ahead, tokens.size() - 1));
	}

	private PygmyToken next() {
		PygmyToken token = tokens.get(pos);
		if (pos < tokens.size() - 1) {
			++pos;
		}
		return token;
	}

	private PygmyToken previous() {
		return tokens.get(Math.max(pos - 1, 0));
	}

	private boolean at(String builtin) {
		return peek().isBuiltin(builtin);
	}

	private boolean at(PygmyTokenType type) {
		return peek().getType() == type;
	}

	private boolean accept(String builtin) {
		if (at(builtin)) {
			next();
			return true;
		}
		return false;
	}

	private static PygmyParseException error(SourceLocation location, String msg) {
		return new PygmyParseException(location, msg);
	}

	private static String describe(PygmyToken token) {
		switch (token.getType()) {
			case NEWLINE:
				return "end of line";
			case INDENT:
				return "indent";
			case DEDENT:
				return "unindent";
			case EOF:
				return "end of file";
			default:
				return "'" + token.getValue() + "'";
		}
	}

	private PygmyToken expect(String builtin) throws PygmyParseException {
		if (!at(builtin)) {
			throw error(peek().getLocation(), "expected '" + builtin + "' but found " + describe(peek()));
		}
		return next();
	}

	private PygmyToken expect(PygmyTokenType type, String what) throws PygmyParseException {
		if (!at(type)) {
			throw error(peek().getLocation(), "expected " + what + " but found " + describe(peek()));
		}
		return next();
	}

	private SourceLocation from(SourceLocation start) {
		return start.combine(previous().getLocation());
	}

	public PygmyUnit readUnit() throws PygmyParseException {
		SourceLocation start = peek().getLocation();
		List<PygmyDeclaration> declarations = new ArrayList<>();
		while (!at(PygmyTokenType.EOF)) {
			if (accept(PygmyTokenType.NEWLINE)) {
				continue;
			}
			if (at(PygmyTokenType.INDENT)) {
				throw error(peek().getLocation(), "unexpected indent");
			}
			declarations.add(readDeclaration());
		}
		return new PygmyUnit(from(start), declarations);
	}

	private boolean accept(PygmyTokenType type) {
		if (at(type)) {
			next();
			return true;
		}
		return false;
	}

	private PygmyDeclaration readDeclaration() throws PygmyParseException {
		PygmyToken first = peek();
		if (first.isBuiltin("import")) {
			return readImport();
		} else if (first.isBuiltin("from")) {
			return readFromImport();
		} else if (first.isBuiltin("def")) {
			return readFunc();
		} else if (first.isBuiltin("class")) {
			return readStruct();
		} else if (first.isBuiltin("@")) {
			throw error(first.getLocation(), "unsupported function decorators");
		} else if (first.getType() == PygmyTokenType.IDENT && peek(1).isBuiltin(":")) {
			PygmyVarDeclaration var = readVarDeclaration();
			expectEndOfLine();
			return var;
		} else if (first.getType() == PygmyTokenType.IDENT && peek(1).isBuiltin("=")) {
			next();
			next();
			PygmyExpression value = readExpressionList();
			if (at("=")) {
				throw error(first.getLocation(), "unsupported multiple assignments");
			}
			expectEndOfLine();
			return new PygmyStaticBinding(from(first.getLocation()),
					new PygmyName(first.getLocation(), first.getValue()), value);
		}
		throw error(first.getLocation(), "unsupported syntax");
	}

	private void expectEndOfLine() throws PygmyParseException {
		if (at(";")) {
			throw error(peek().getLocation(), "unsupported syntax");
		}
		expect(PygmyTokenType.NEWLINE, "end of line");
	}

	private String readDottedName() throws PygmyParseException {
		StringBuilder name = new StringBuilder(expect(PygmyTokenType.IDENT, "module name").getValue());
		while (accept(".")) {
			name.append('.').append(expect(PygmyTokenType.IDENT, "module name").getValue());
		}
		return name.toString();
	}

	private PygmyImport readImport() throws PygmyParseException {
		SourceLocation start = expect("import").getLocation();
		String module = readDottedName();
		String alias = null;
		if (accept("as")) {
			alias = expect(PygmyTokenType.IDENT, "name").getValue();
		}
		if (at(",")) {
			throw error(peek().getLocation(), "unsupported multiple imports");
		}
		PygmyImport result = new PygmyImport(from(start), module, alias, Collections.emptyMap());
		expectEndOfLine();
		return result;
	}

	private PygmyImport readFromImport() throws PygmyParseException {
		SourceLocation start = expect("from").getLocation();
		if (at(".")) {
			throw error(peek().getLocation(), "unsupported relative import");
		}
		String module = readDottedName();
		expect("import");
		if (at("*")) {
			throw error(peek().getLocation(), "unsupported star import");
		}
		boolean parenthesized = accept("(");
		Map<String, String> names = new LinkedHashMap<>();
		do {
			if (parenthesized && at(")")) {
				break;
			}
			String name = expect(PygmyTokenType.IDENT, "name").getValue();
			String alias = name;
			if (accept("as")) {
				alias = expect(PygmyTokenType.IDENT, "name").getValue();
			}
			names.put(alias, name);
		} while (accept(","));
		if (parenthesized) {
			expect(")");
		}
		PygmyImport result = new PygmyImport(from(start), module, null, names);
		expectEndOfLine();
		return result;
	}

	private PygmyVarDeclaration readVarDeclaration() throws PygmyParseException {
		PygmyToken nameToken = expect(PygmyTokenType.IDENT, "name");
		expect(":");
		PygmyExpression annotation = readPostfix();
		PygmyExpression type = annotation;
		PygmyExpression size = null;
		if (annotation instanceof PygmyItem) {
			type = ((PygmyItem) annotation).getValue();
			size = ((PygmyItem) annotation).getItem();
		}
		if (!(type instanceof PygmyLookup) || type instanceof PygmyItem) {
			throw error(annotation.getLocation(), "unsupported type");
		}
		PygmyExpression init = null;
		if (accept("=")) {
			init = readExpressionList();
		}
		return new PygmyVarDeclaration(from(nameToken.getLocation()),
				new PygmyName(nameToken.getLocation(), nameToken.getValue()), type, size, init);
	}

	private PygmyStructDeclaration readStruct() throws PygmyParseException {
		SourceLocation start = expect("class").getLocation();
		PygmyToken nameToken = expect(PygmyTokenType.IDENT, "class name");
		List<PygmyExpression> parents = new ArrayList<>();
		if (accept("(")) {
			while (!at(")")) {
				if (peek().getType() == PygmyTokenType.IDENT && peek(1).isBuiltin("=")) {
					throw error(peek().getLocation(), "unsupported syntax");
				}
				PygmyExpression parent = readExpression();
				if (!(parent instanceof PygmyName)) {
					throw error(parent.getLocation(), "expected name");
				}
				parents.add(parent);
				if (!accept(",")) {
					break;
				}
			}
			expect(")");
		}
		expect(":");
		SourceLocation header = from(start);
		List<PygmyVarDeclaration> fields = new ArrayList<>();
		expect(PygmyTokenType.NEWLINE, "end of line");
		expect(PygmyTokenType.INDENT, "indented class body");
		while (!accept(PygmyTokenType.DEDENT)) {
			if (accept("pass")) {
				expectEndOfLine();
				continue;
			}
			if (!(at(PygmyTokenType.IDENT) && peek(1).isBuiltin(":"))) {
				throw error(peek().getLocation(), "unexpected field");
			}
			fields.add(readVarDeclaration());
			expectEndOfLine();
		}
		return new PygmyStructDeclaration(header, new PygmyName(nameToken.getLocation(), nameToken.getValue()),
				parents, fields);
	}

	private PygmyFuncDeclaration readFunc() throws PygmyParseException {
		SourceLocation start = expect("def").getLocation();
		PygmyToken nameToken = expect(PygmyTokenType.IDENT, "function name");
		expect("(");
		List<PygmyName> params = new ArrayList<>();
		while (!at(")")) {
			if (at("*") || at("**") || at("/")) {
				throw error(peek().getLocation(), "unsupported function arguments");
			}
			PygmyToken param = expect(PygmyTokenType.IDENT, "parameter name");
			if (at("=") || at(":")) {
				throw error(peek().getLocation(), "unsupported function arguments");
			}
			params.add(new PygmyName(param.getLocation(), param.getValue()));
			if (!accept(",")) {
				break;
			}
		}
		expect(")");
		if (at("->")) {
			throw error(peek().getLocation(), "unsupported function annotation");
		}
		expect(":");
		SourceLocation header = from(start);
		List<PygmyNode> body = new ArrayList<>();
		if (!accept(PygmyTokenType.NEWLINE)) {
			body.add(readSimpleStatement());
		} else {
			expect(PygmyTokenType.INDENT, "indented function body");
			while (!accept(PygmyTokenType.DEDENT)) {
				body.add(readFunctionItem());
			}
		}
		return new PygmyFuncDeclaration(header, new PygmyName(nameToken.getLocation(), nameToken.getValue()),
				params, body);
	}

	private PygmyNode readFunctionItem() throws PygmyParseException {
		if (at("global")) {
			SourceLocation start = next().getLocation();
			List<PygmyName> names = new ArrayList<>();
			do {
				PygmyToken name = expect(PygmyTokenType.IDENT, "name");
				names.add(new PygmyName(name.getLocation(), name.getValue()));
			} while (accept(","));
			PygmyGlobal global = new PygmyGlobal(from(start), names);
			expectEndOfLine();
			return global;
		}
		if (at(PygmyTokenType.IDENT) && peek(1).isBuiltin(":")) {
			PygmyVarDeclaration var = readVarDeclaration();
			expectEndOfLine();
			return var;
		}
		return readStatement();
	}

	private List<PygmyStatement> readBlock() throws PygmyParseException {
		List<PygmyStatement> block = new ArrayList<>();
		if (!accept(PygmyTokenType.NEWLINE)) {
			block.add(readSimpleStatement());
			return block;
		}
		expect(PygmyTokenType.INDENT, "indented block");
		while (!accept(PygmyTokenType.DEDENT)) {
			if (at("def") || at("class") || at("global") || at("nonlocal") ||
					(at(PygmyTokenType.IDENT) && peek(1).isBuiltin(":"))) {
				throw error(peek().getLocation(), "unsupported nested declaration");
			}
			block.add(readStatement());
		}
		return block;
	}

	private PygmyStatement readStatement() throws PygmyParseException {
		PygmyToken first = peek();
		if (first.isBuiltin("if")) {
			next();
			return readIfRest(first.getLocation());
		} else if (first.isBuiltin("for")) {
			return readFor();
		} else if (first.isBuiltin("def") || first.isBuiltin("class")) {
			throw error(first.getLocation(), "unsupported nested declaration");
		}
		return readSimpleStatement();
	}

	private PygmyStatement readIfRest(SourceLocation start) throws PygmyParseException {
		PygmyExpression condition = readExpression();
		expect(":");
		SourceLocation header = from(start);
		List<PygmyStatement> then = readBlock();
		List<PygmyStatement> orElse = new ArrayList<>();
		if (at("elif")) {
			SourceLocation elif = next().getLocation();
			orElse.add(readIfRest(elif));
		} else if (accept("else")) {
			expect(":");
			orElse = readBlock();
		}
		return new PygmyIf(header, condition, then, orElse);
	}

	private PygmyStatement readFor() throws PygmyParseException {
		SourceLocation start = expect("for").getLocation();
		PygmyToken variable = peek();
		if (variable.getType() != PygmyTokenType.IDENT || !peek(1).isBuiltin("in")) {
			throw error(variable.getLocation(), "unsupported iterator");
		}
		next();
		PygmyName target = new PygmyName(variable.getLocation(), variable.getValue());
		expect("in");
		PygmyExpression iterable = readExpressionList();
		expect(":");
		SourceLocation header = from(start);
		List<PygmyStatement> body = readBlock();
		if (at("else")) {
			throw error(start, "unsupported 'else' in for loop");
		}
		return new PygmyFor(header, target, iterable, body);
	}

	private PygmyStatement readSimpleStatement() throws PygmyParseException {
		PygmyToken first = peek();
		SourceLocation start = first.getLocation();
		PygmyStatement result;
		if (accept("pass")) {
			result = new PygmyPass(start);
		} else if (accept("return")) {
			PygmyExpression value = null;
			if (!at(PygmyTokenType.NEWLINE)) {
				value = readExpressionList();
			}
			result = new PygmyReturn(from(start), value);
		} else if (first.getType() == PygmyTokenType.BUILTIN && first.getValue().matches("[a-z]+") &&
				!first.isBuiltin("not")) {
			throw error(start, "unsupported syntax");
		} else {
			PygmyExpression expression = readExpressionList();
			if (at("=")) {
				next();
				if (!(expression instanceof PygmyLookup)) {
					throw error(expression.getLocation(), "unsupported assignment target");
				}
				PygmyExpression value = readExpressionList();
				if (at("=")) {
					throw error(start, "unsupported multiple assignments");
				}
				result = new PygmyAssign(from(start), (PygmyLookup) expression, value, null);
			} else if (at("+=") || at("-=")) {
				String op = next().getValue().substring(0, 1);
				if (!(expression instanceof PygmyLookup)) {
					throw error(expression.getLocation(), "unsupported assignment target");
				}
				PygmyExpression value = readExpressionList();
				result = new PygmyAssign(from(start), (PygmyLookup) expression, value, op);
			} else if (UNSUPPORTED_AUGOPS.contains(peek().getValue()) && at(PygmyTokenType.BUILTIN)) {
				throw error(peek().getLocation(), "unsupported operator");
			} else if (at(":")) {
				throw error(start, "unsupported nested declaration");
			} else if (expression instanceof PygmyCall) {
				result = new PygmyBareCall(from(start), (PygmyCall) expression);
			} else {
				throw error(start, "bare expressions not supported");
			}
		}
		expectEndOfLine();
		return result;
	}

	/**
	 * Reads a single line holding either an assignment or a bare expression, such as {@code x += 2*y} or
	 * {@code x <= y + 1}.
	 */
	public PygmyNode readLine() throws PygmyParseException {
		SourceLocation start = peek().getLocation();
		PygmyNode result;
		PygmyExpression expression = readExpression();
		if (at("=") || at("+=") || at("-=")) {
			String op = next().getValue();
			if (!(expression instanceof PygmyLookup)) {
				throw error(expression.getLocation(), "unsupported assignment target");
			}
			PygmyExpression value = readExpression();
			result = new PygmyAssign(from(start), (PygmyLookup) expression, value,
					op.equals("=") ? null : op.substring(0, 1));
		} else {
			result = expression;
		}
		expectEndOfLine();
		if (!at(PygmyTokenType.EOF)) {
			throw error(peek().getLocation(), "unexpected " + describe(peek()));
		}
		return result;
	}

	/**
	 * An expression, or a tuple of expressions separated by commas.
	 */
	private PygmyExpression readExpressionList() throws PygmyParseException {
		SourceLocation start = peek().getLocation();
		PygmyExpression first = readExpression();
		if (!at(",")) {
			return first;
		}
		List<PygmyExpression> elements = new ArrayList<>();
		elements.add(first);
		while (accept(",")) {
			if (at(PygmyTokenType.NEWLINE) || at("=") || at(":")) {
				break;
			}
			elements.add(readExpression());
		}
		return new PygmySequence(from(start), elements);
	}

	public PygmyExpression readExpression() throws PygmyParseException {
		if (at("lambda")) {
			throw error(peek().getLocation(), "unsupported syntax");
		}
		PygmyExpression result = readOr();
		if (at("if")) {
			throw error(peek().getLocation(), "unsupported syntax");
		}
		return result;
	}

	private PygmyExpression readOr() throws PygmyParseException {
		SourceLocation start = peek().getLocation();
		PygmyExpression first = readAnd();
		if (!at("or")) {
			return first;
		}
		List<PygmyExpression> children = new ArrayList<>();
		children.add(first);
		while (accept("or")) {
			children.add(readAnd());
		}
		return new PygmyOp(from(start), "or", children);
	}

	private PygmyExpression readAnd() throws PygmyParseException {
		SourceLocation start = peek().getLocation();
		PygmyExpression first = readNot();
		if (!at("and")) {
			return first;
		}
		List<PygmyExpression> children = new ArrayList<>();
		children.add(first);
		while (accept("and")) {
			children.add(readNot());
		}
		return new PygmyOp(from(start), "and", children);
	}

	private PygmyExpression readNot() throws PygmyParseException {
		SourceLocation start = peek().getLocation();
		if (accept("not")) {
			PygmyExpression operand = readNot();
			return new PygmyOp(from(start), "not", Collections.singletonList(operand));
		}
		return readComparison();
	}

	private PygmyExpression readComparison() throws PygmyParseException {
		SourceLocation start = peek().getLocation();
		PygmyExpression left = readArith();
		List<PygmyExpression> pairs = new ArrayList<>();
		while (true) {
			PygmyToken op = peek();
			if (op.isBuiltin("in") || op.isBuiltin("is") || (op.isBuiltin("not") && peek(1).isBuiltin("in"))) {
				throw error(op.getLocation(), "unsupported operator");
			}
			if (op.getType() != PygmyTokenType.BUILTIN || !COMPARISON_OPS.contains(op.getValue())) {
				break;
			}
			next();
			PygmyExpression right = readArith();
			pairs.add(new PygmyOp(left.getLocation().combine(right.getLocation()), op.getValue(),
					Arrays.asList(left, right)));
			left = right;
		}
		if (pairs.isEmpty()) {
			return left;
		} else if (pairs.size() == 1) {
			return pairs.get(0);
		}
		return new PygmyOp(from(start), "and", pairs);
	}

	private PygmyExpression readArith() throws PygmyParseException {
		SourceLocation start = peek().getLocation();
		PygmyExpression result = readTerm();
		while (at("+") || at("-")) {
			String op = next().getValue();
			PygmyExpression right = readTerm();
			result = new PygmyOp(from(start), op, Arrays.asList(result, right));
		}
		return result;
	}

	private PygmyExpression readTerm() throws PygmyParseException {
		SourceLocation start = peek().getLocation();
		PygmyExpression result = readFactor();
		while (true) {
			if (at(PygmyTokenType.BUILTIN) && UNSUPPORTED_BINOPS.contains(peek().getValue())) {
				throw error(peek().getLocation(), "unsupported operator");
			}
			if (!accept("*")) {
				break;
			}
			PygmyExpression right = readFactor();
			result = new PygmyOp(from(start), "*", Arrays.asList(result, right));
		}
		return result;
	}

	private PygmyExpression readFactor() throws PygmyParseException {
		SourceLocation start = peek().getLocation();
		if (accept("-")) {
			PygmyExpression operand = readFactor();
			return new PygmyOp(from(start), "-", Collections.singletonList(operand));
		} else if (accept("+")) {
			return readFactor();
		} else if (at("~")) {
			throw error(start, "unsupported operator");
		}
		PygmyExpression result = readPostfix();
		if (at("**")) {
			throw error(peek().getLocation(), "unsupported operator");
		}
		return result;
	}

	private PygmyExpression readPostfix() throws PygmyParseException {
		SourceLocation start = peek().getLocation();
		PygmyExpression result = readAtom();
		while (true) {
			if (at(".")) {
				next();
				if (!(result instanceof PygmyLookup)) {
					throw error(result.getLocation(), "unsupported syntax");
				}
				PygmyToken attr = expect(PygmyTokenType.IDENT, "attribute name");
				result = new PygmyAttr(from(start), (PygmyLookup) result, attr.getValue());
			} else if (at("[")) {
				next();
				if (!(result instanceof PygmyLookup)) {
					throw error(result.getLocation(), "unsupported syntax");
				}
				if (at(":")) {
					throw error(peek().getLocation(), "unsupported syntax");
				}
				PygmyExpression item = readExpression();
				if (at(":") || at(",")) {
					throw error(peek().getLocation(), "unsupported syntax");
				}
				expect("]");
				result = new PygmyItem(from(start), (PygmyLookup) result, item);
			} else if (at("(")) {
				PygmyToken paren = next();
				if (!(result instanceof PygmyLookup)) {
					throw error(result.getLocation(), "unsupported function");
				}
				List<PygmyExpression> args = new ArrayList<>();
				while (!at(")")) {
					if (at("*") || at("**") || (at(PygmyTokenType.IDENT) && peek(1).isBuiltin("="))) {
						throw error(peek().getLocation(), "unsupported argument");
					}
					args.add(readExpression());
					if (at("for")) {
						throw error(peek().getLocation(), "unsupported syntax");
					}
					if (!accept(",")) {
						break;
					}
				}
				expect(")");
				result = new PygmyCall(from(start), (PygmyLookup) result, args);
				if (at(".") || at("[") || at("(")) {
					throw error(paren.getLocation(), "unsupported syntax");
				}
			} else {
				return result;
			}
		}
	}

	private PygmyExpression readAtom() throws PygmyParseException {
		PygmyToken token = peek();
		SourceLocation start = token.getLocation();
		switch (token.getType()) {
			case IDENT:
				next();
				return new PygmyName(start, token.getValue());
			case NUMBER:
				next();
				return new PygmyConst(start, parseInt(token));
			case STRING:
				throw error(start, "unsupported value");
			case BUILTIN:
				break;
			default:
				throw error(start, "unexpected " + describe(token));
		}
		if (accept("True")) {
			return new PygmyConst(start, true);
		} else if (accept("False")) {
			return new PygmyConst(start, false);
		} else if (at("None")) {
			throw error(start, "unsupported value");
		} else if (accept("(")) {
			if (accept(")")) {
				return new PygmySequence(from(start), Collections.emptyList());
			}
			PygmyExpression first = readExpression();
			if (accept(")")) {
				return first;
			}
			List<PygmyExpression> elements = new ArrayList<>();
			elements.add(first);
			while (accept(",")) {
				if (at(")")) {
					break;
				}
				elements.add(readExpression());
			}
			if (at("for")) {
				throw error(peek().getLocation(), "unsupported syntax");
			}
			expect(")");
			return new PygmySequence(from(start), elements);
		} else if (accept("[")) {
			List<PygmyExpression> elements = new ArrayList<>();
			while (!at("]")) {
				elements.add(readExpression());
				if (at("for")) {
					throw error(peek().getLocation(), "unsupported syntax");
				}
				if (!accept(",")) {
					break;
				}
			}
			expect("]");
			return new PygmySequence(from(start), elements);
		}
		throw error(start, "unsupported syntax");
	}

	private static int parseInt(PygmyToken token) throws PygmyParseException {
		String text = token.getValue().replace("_", "");
		String lower = text.toLowerCase();
		int radix = 10;
		if (lower.startsWith("0x")) {
			radix = 16;
			text = text.substring(2);
		} else if (lower.startsWith("0o")) {
			radix = 8;
			text = text.substring(2);
		} else if (lower.startsWith("0b")) {
			radix = 2;
			text = text.substring(2);
		} else if (lower.contains(".") || lower.contains("e")) {
			throw error(token.getLocation(), "unsupported value");
		}
		try {
			return Integer.parseInt(text, radix);
		} catch (NumberFormatException e) {
			throw error(token.getLocation(), "unsupported value");
		}
	}

}
