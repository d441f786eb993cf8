package daddy.lexer;

import daddy.DaddyException;
import daddy.util.SourceLocation;

public class PygmyLexerException extends DaddyException {

	private final SourceLocation location;

	public PygmyLexerException(SourceLocation location, String msg) {
		super("Lexer error", msg);
		this.location = location;
	}

	public SourceLocation getLocation() {
		return location;
	}

}
