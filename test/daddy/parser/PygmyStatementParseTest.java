package daddy.parser;

import daddy.lexer.PygmyLexer;
import daddy.model.pygmy.PygmyFuncDeclaration;
import daddy.model.pygmy.PygmyNode;
import daddy.model.pygmy.PygmyUnit;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static daddy.model.pygmy.PygmyBuilder.*;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

@RunWith(Parameterized.class)
public class PygmyStatementParseTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][]{
				{"pass", pass()},
				{"x = 1", assign(name("x"), num(1))},
				{"a[i] += y", augAssign(item(name("a"), name("i")), "+", name("y"))},
				{"p.f -= 2", augAssign(attr(name("p"), "f"), "-", num(2))},
				{"return", returnS()},
				{"return x + 1", returnS(op("+", name("x"), num(1)))},
				{"g(x)", bareCall("g", name("x"))},
				{"if x:\n        y = 1\n    elif z:\n        y = 2\n    else:\n        pass",
						ifS(name("x"),
								block(assign(name("y"), num(1))),
								block(ifS(name("z"),
										block(assign(name("y"), num(2))),
										block(pass()))))},
				{"if x: y = 1", ifS(name("x"), block(assign(name("y"), num(1))), Collections.emptyList())},
				{"for i in range(3):\n        y += i",
						forS("i", call("range", num(3)), augAssign(name("y"), "+", name("i")))},
		});
	}

	private final String statement;
	private final PygmyNode expected;

	public PygmyStatementParseTest(String statement, PygmyNode expected) {
		this.statement = statement;
		this.expected = expected;
	}

	@Test
	public void test() throws PygmyParseException {
		String source = "def f():\n    " + statement + "\n";
		PygmyUnit unit = new PygmyParser(new PygmyLexer(Paths.get("TEST"), source).readTokens()).readUnit();
		assertThat(unit.getDeclarations().size(), is(1));
		assertThat(unit.getDeclarations().get(0), instanceOf(PygmyFuncDeclaration.class));
		List<PygmyNode> body = ((PygmyFuncDeclaration) unit.getDeclarations().get(0)).getBody();
		assertThat(body, is(Collections.singletonList(expected)));
	}

}
