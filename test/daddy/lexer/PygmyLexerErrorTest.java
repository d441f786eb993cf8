package daddy.lexer;

import org.junit.Test;

import java.nio.file.Paths;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

public class PygmyLexerErrorTest {

	private static PygmyLexerException lex(String source) {
		try {
			new PygmyLexer(Paths.get("TEST"), source).readTokens();
		} catch (PygmyLexerException e) {
			return e;
		}
		fail("expected a lexer error for: " + source);
		return null;
	}

	@Test
	public void unexpectedCharacter() {
		PygmyLexerException e = lex("x = $");
		assertThat(e.getMsg(), is("unexpected character '$'"));
		assertThat(e.getLocation().getStartColumn(), is(4));
	}

	@Test
	public void badUnindent() {
		PygmyLexerException e = lex("if x:\n    pass\n  pass");
		assertThat(e.getMsg(), is("unindent does not match any outer indentation level"));
		assertThat(e.getLocation().getStartLine(), is(3));
	}

	@Test
	public void unclosedBracket() {
		assertThat(lex("x = (1 +\n2").getMsg(), is("unexpected end of file inside brackets"));
	}

}
