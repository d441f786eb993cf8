package daddy.lexer;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

@RunWith(Parameterized.class)
public class PygmyLexerTest {

	static Path testFile = Paths.get("TEST");

	private static String tok(String value, PygmyTokenType type) {
		return type + " " + value;
	}

	private static String ident(String value) {
		return tok(value, PygmyTokenType.IDENT);
	}

	private static String num(String value) {
		return tok(value, PygmyTokenType.NUMBER);
	}

	private static String builtin(String value) {
		return tok(value, PygmyTokenType.BUILTIN);
	}

	private static final String NEWLINE = tok("", PygmyTokenType.NEWLINE);
	private static final String INDENT = tok("", PygmyTokenType.INDENT);
	private static final String DEDENT = tok("", PygmyTokenType.DEDENT);
	private static final String EOF = tok("", PygmyTokenType.EOF);

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][]{
				{"x", Arrays.asList(ident("x"), NEWLINE, EOF)},
				{"x += 0x1f", Arrays.asList(ident("x"), builtin("+="), num("0x1f"), NEWLINE, EOF)},
				{"a<=b", Arrays.asList(ident("a"), builtin("<="), ident("b"), NEWLINE, EOF)},
				{"not True # comment", Arrays.asList(builtin("not"), builtin("True"), NEWLINE, EOF)},
				{"def f():\n    pass\n", Arrays.asList(
						builtin("def"), ident("f"), builtin("("), builtin(")"), builtin(":"), NEWLINE,
						INDENT, builtin("pass"), NEWLINE,
						DEDENT, EOF)},
				{"if x:\n  if y:\n    pass\nz = 1", Arrays.asList(
						builtin("if"), ident("x"), builtin(":"), NEWLINE,
						INDENT, builtin("if"), ident("y"), builtin(":"), NEWLINE,
						INDENT, builtin("pass"), NEWLINE,
						DEDENT, DEDENT, ident("z"), builtin("="), num("1"), NEWLINE, EOF)},
				{"a = [1,\n     2]\n\n   # indented comment\nb = a", Arrays.asList(
						ident("a"), builtin("="), builtin("["), num("1"), builtin(","), num("2"), builtin("]"),
						NEWLINE,
						ident("b"), builtin("="), ident("a"), NEWLINE, EOF)},
				{"x = 1 + \\\n  2", Arrays.asList(
						ident("x"), builtin("="), num("1"), builtin("+"), num("2"), NEWLINE, EOF)},
		});
	}

	private final String source;
	private final List<String> expected;

	public PygmyLexerTest(String source, List<String> expected) {
		this.source = source;
		this.expected = expected;
	}

	@Test
	public void test() throws PygmyLexerException {
		PygmyLexer lexer = new PygmyLexer(testFile, source);
		List<String> actual = new ArrayList<>();
		for (PygmyToken token : lexer.readTokens()) {
			actual.add(tok(token.getValue(), token.getType()));
		}
		assertThat(actual, is(expected));
	}

}
