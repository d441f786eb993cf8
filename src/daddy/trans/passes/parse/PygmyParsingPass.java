package daddy.trans.passes.parse;

import daddy.errors.IssueContext;
import daddy.lexer.PygmyLexer;
import daddy.lexer.PygmyLexerException;
import daddy.lexer.PygmyToken;
import daddy.model.pygmy.PygmyUnit;
import daddy.parser.PygmyParseException;
import daddy.parser.PygmyParser;

import java.nio.file.Path;
import java.util.List;

public class PygmyParsingPass {
	private PygmyParsingPass() {}

	public static PygmyUnit perform(IssueContext ctx, Path inputFileName, CharSequence inputFileContents) {
		try {
			List<PygmyToken> tokens = new PygmyLexer(inputFileName, inputFileContents.toString()).readTokens();
			return new PygmyParser(tokens).readUnit();
		} catch (PygmyLexerException e) {
			ctx.error(new ParsingIssue(e.getLocation(), e.getMsg()));
			return null;
		} catch (PygmyParseException e) {
			ctx.error(new ParsingIssue(e.getLocation(), e.getMsg()));
			return null;
		}
	}
}
