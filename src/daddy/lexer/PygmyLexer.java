package daddy.lexer;

import daddy.util.SourceLocation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexer for the indentation-based pygmy syntax.
 *
 * Besides identifiers, numbers and the BUILTIN keywords and operators, it emits NEWLINE at the end of every
 * logical line and INDENT / DEDENT when the indentation changes. Line breaks inside brackets, or after a
 * trailing backslash, do not end a logical line. Keywords of the host language that pygmy does not support are
 * still lexed as BUILTIN so the parser can reject them with a precise message.
 */
public class PygmyLexer {

	static final Pattern WHITESPACE = Pattern.compile("[ \\t\\f]+");
	static final Pattern COMMENT = Pattern.compile("#.*");
	static final Pattern IDENT = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");
	static final Pattern NUMBER = Pattern.compile(
			"0[xX][0-9a-fA-F_]+|0[oO][0-7_]+|0[bB][01_]+|[0-9][0-9_]*(\\.[0-9]*)?([eE][+-]?[0-9]+)?|\\.[0-9]+");
	static final Pattern STRING = Pattern.compile("\"([^\"\\\\]|\\\\.)*\"|'([^'\\\\]|\\\\.)*'");

	static final List<String> KEYWORDS = Arrays.asList(
			"True", "False", "None",
			"and", "or", "not", "in", "is",
			"if", "elif", "else", "for", "while", "break", "continue", "pass", "return",
			"def", "class", "global", "nonlocal", "import", "from", "as",
			"lambda", "with", "try", "except", "finally", "raise", "del", "assert", "yield", "async", "await");

	// longest first, so that a prefix never shadows a longer operator
	static final List<String> OPERATORS;

	static {
		List<String> ops = new ArrayList<>(Arrays.asList(
				"**=", "//=", ">>=", "<<=",
				"==", "!=", "<=", ">=", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=",
				"**", "//", "<<", ">>", "->", ":=",
				"+", "-", "*", "/", "%", "@", "<", ">", "=", "~", "&", "|", "^",
				"(", ")", "[", "]", "{", "}", ",", ":", ".", ";"));
		ops.sort(Comparator.comparingInt(String::length).reversed());
		OPERATORS = ops;
	}

	private final Path filename;
	private final List<String> lines;

	public PygmyLexer(Path filename) throws IOException {
		this(filename, Files.readAllLines(filename));
	}

	public PygmyLexer(Path filename, List<String> lines) {
		this.filename = filename;
		this.lines = lines;
	}

	public PygmyLexer(Path filename, String source) {
		this(filename, Arrays.asList(source.split("\r?\n", -1)));
	}

	private SourceLocation location(int lineOffset, int lineNum, int column, int length) {
		return new SourceLocation(filename, lineOffset + column, lineOffset + column + length, lineNum, lineNum,
				column, column + length, lines.get(lineNum - 1));
	}

	private PygmyToken makeToken(String value, PygmyTokenType type, int lineOffset, int lineNum, int column) {
		return new PygmyToken(value, type, location(lineOffset, lineNum, column, value.length()));
	}

	private static int indentWidth(String line, int end) {
		int width = 0;
		for (int i = 0; i < end; i++) {
			if (line.charAt(i) == '\t') {
				width = (width / 8 + 1) * 8;
			} else {
				width++;
			}
		}
		return width;
	}

	/**
	 * @return the tokens of the whole input, always terminated by NEWLINE (if anything was read), the DEDENTs
	 * closing every open block, and EOF
	 * @throws PygmyLexerException if a character cannot start any token, or on inconsistent indentation
	 */
	public List<PygmyToken> readTokens() throws PygmyLexerException {
		List<PygmyToken> tokens = new ArrayList<>();
		Deque<Integer> indents = new ArrayDeque<>();
		indents.push(0);
		// open brackets, inside which line breaks and indentation are ignored
		int depth = 0;
		boolean continuation = false;
		int lineOffset = 0;
		int lineNum = 0;
		int lastLine = 1;
		int lastColumn = 0;
		int lastOffset = 0;
		for (String line : lines) {
			++lineNum;
			int column = 0;
			Matcher m = WHITESPACE.matcher(line);
			if (m.lookingAt()) {
				column = m.end();
			}
			boolean blank = column == line.length() || line.charAt(column) == '#';
			if (!blank && depth == 0 && !continuation) {
				int width = indentWidth(line, column);
				if (width > indents.peek()) {
					indents.push(width);
					tokens.add(makeToken("", PygmyTokenType.INDENT, lineOffset, lineNum, column));
				} else {
					while (width < indents.peek()) {
						indents.pop();
						tokens.add(makeToken("", PygmyTokenType.DEDENT, lineOffset, lineNum, column));
					}
					if (width != indents.peek()) {
						throw new PygmyLexerException(location(lineOffset, lineNum, column, 0),
								"unindent does not match any outer indentation level");
					}
				}
			}
			continuation = false;
			boolean sawToken = false;
			while (column < line.length()) {
				m = WHITESPACE.matcher(line);
				m.region(column, line.length());
				if (m.lookingAt()) {
					column = m.end();
					continue;
				}
				m = COMMENT.matcher(line);
				m.region(column, line.length());
				if (m.lookingAt()) {
					column = line.length();
					continue;
				}
				if (line.charAt(column) == '\\' && column == line.length() - 1) {
					continuation = true;
					column = line.length();
					continue;
				}
				m = IDENT.matcher(line);
				m.region(column, line.length());
				if (m.lookingAt()) {
					PygmyTokenType type = KEYWORDS.contains(m.group()) ? PygmyTokenType.BUILTIN : PygmyTokenType.IDENT;
					tokens.add(makeToken(m.group(), type, lineOffset, lineNum, column));
					column = m.end();
					sawToken = true;
					continue;
				}
				m = NUMBER.matcher(line);
				m.region(column, line.length());
				if (m.lookingAt()) {
					tokens.add(makeToken(m.group(), PygmyTokenType.NUMBER, lineOffset, lineNum, column));
					column = m.end();
					sawToken = true;
					continue;
				}
				m = STRING.matcher(line);
				m.region(column, line.length());
				if (m.lookingAt()) {
					tokens.add(makeToken(m.group(), PygmyTokenType.STRING, lineOffset, lineNum, column));
					column = m.end();
					sawToken = true;
					continue;
				}
				String operator = null;
				for (String op : OPERATORS) {
					if (line.startsWith(op, column)) {
						operator = op;
						break;
					}
				}
				if (operator == null) {
					throw new PygmyLexerException(location(lineOffset, lineNum, column, 1),
							"unexpected character '" + line.charAt(column) + "'");
				}
				if ("([{".contains(operator)) {
					++depth;
				} else if (")]}".contains(operator)) {
					if (depth == 0) {
						throw new PygmyLexerException(location(lineOffset, lineNum, column, 1),
								"unmatched '" + operator + "'");
					}
					--depth;
				}
				tokens.add(makeToken(operator, PygmyTokenType.BUILTIN, lineOffset, lineNum, column));
				column += operator.length();
				sawToken = true;
			}
			if (sawToken) {
				lastLine = lineNum;
				lastColumn = line.length();
				lastOffset = lineOffset;
			}
			if (sawToken && depth == 0 && !continuation) {
				tokens.add(makeToken("", PygmyTokenType.NEWLINE, lineOffset, lineNum, line.length()));
			}
			lineOffset += line.length() + 1;
		}
		if (depth > 0) {
			throw new PygmyLexerException(location(lastOffset, lastLine, lastColumn, 0),
					"unexpected end of file inside brackets");
		}
		if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).getType() != PygmyTokenType.NEWLINE) {
			tokens.add(makeToken("", PygmyTokenType.NEWLINE, lastOffset, lastLine, lastColumn));
		}
		while (indents.peek() > 0) {
			indents.pop();
			tokens.add(makeToken("", PygmyTokenType.DEDENT, lastOffset, lastLine, lastColumn));
		}
		if (lines.isEmpty()) {
			tokens.add(new PygmyToken("", PygmyTokenType.EOF, SourceLocation.unknown()));
		} else {
			tokens.add(makeToken("", PygmyTokenType.EOF, lastOffset, lastLine, lastColumn));
		}
		return tokens;
	}

}
