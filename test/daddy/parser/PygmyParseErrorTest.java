package daddy.parser;

import daddy.lexer.PygmyLexer;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

@RunWith(Parameterized.class)
public class PygmyParseErrorTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][]{
				{"from pygmy import *\n", "unsupported star import", 1, 18},
				{"def f(x=1):\n    pass\n", "unsupported function arguments", 1, 7},
				{"def f():\n    x = 1 / 2\n", "unsupported operator", 2, 10},
				{"def f():\n    x = y = 1\n", "unsupported multiple assignments", 2, 4},
				{"def f():\n    x *= 2\n", "unsupported operator", 2, 6},
				{"def f():\n    while x:\n        pass\n", "unsupported syntax", 2, 4},
				{"def f():\n    x = 'a'\n", "unsupported value", 2, 8},
				{"def f():\n    x\n", "bare expressions not supported", 2, 4},
				{"def f():\n    if x:\n        y: int = 0\n", "unsupported nested declaration", 3, 8},
				{"@g\ndef f():\n    pass\n", "unsupported function decorators", 1, 0},
				{"def f():\n    x = len([i for i in y])\n", "unsupported syntax", 2, 15},
				{"def f():\n    x = sum(i for i in y)\n", "unsupported syntax", 2, 14},
		});
	}

	private final String source;
	private final String message;
	private final int line;
	private final int column;

	public PygmyParseErrorTest(String source, String message, int line, int column) {
		this.source = source;
		this.message = message;
		this.line = line;
		this.column = column;
	}

	@Test
	public void test() {
		try {
			new PygmyParser(new PygmyLexer(Paths.get("TEST"), source).readTokens()).readUnit();
			fail("expected a parse error");
		} catch (PygmyParseException e) {
			assertThat(e.getMsg(), is(message));
			assertThat(e.getLocation().getStartLine(), is(line));
			assertThat(e.getLocation().getStartColumn(), is(column));
		}
	}

}
