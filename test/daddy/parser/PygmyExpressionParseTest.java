package daddy.parser;

import daddy.lexer.PygmyLexer;
import daddy.model.pygmy.PygmyExpression;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

import static daddy.model.pygmy.PygmyBuilder.*;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

@RunWith(Parameterized.class)
public class PygmyExpressionParseTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][]{
				{"1", num(1)},
				{"0b101", num(5)},
				{"1_000", num(1000)},
				{"True", bool(true)},
				{"x", name("x")},
				{"a + 2*b", op("+", name("a"), op("*", num(2), name("b")))},
				{"a - b - c", op("-", op("-", name("a"), name("b")), name("c"))},
				{"-x", op("-", name("x"))},
				{"+x", name("x")},
				{"(a + b) * 3", op("*", op("+", name("a"), name("b")), num(3))},
				{"a < b", op("<", name("a"), name("b"))},
				{"a < b <= c", op("and", op("<", name("a"), name("b")), op("<=", name("b"), name("c")))},
				{"not a or b and c", op("or", op("not", name("a")), op("and", name("b"), name("c")))},
				{"p.f", attr(name("p"), "f")},
				{"ps[2].f", attr(item(name("ps"), num(2)), "f")},
				{"f(1, x)", call("f", num(1), name("x"))},
				{"f()", call("f")},
				{"[1, 2]", seq(num(1), num(2))},
				{"(1,)", seq(num(1))},
				{"()", seq()},
		});
	}

	private final String source;
	private final PygmyExpression expected;

	public PygmyExpressionParseTest(String source, PygmyExpression expected) {
		this.source = source;
		this.expected = expected;
	}

	@Test
	public void test() throws PygmyParseException {
		PygmyParser parser = new PygmyParser(new PygmyLexer(Paths.get("TEST"), source).readTokens());
		assertThat(parser.readExpression(), is(expected));
	}

}
