package daddy.parser;

import daddy.DaddyException;
import daddy.util.SourceLocation;

public class PygmyParseException extends DaddyException {

	private final SourceLocation location;

	public PygmyParseException(SourceLocation location, String msg) {
		super("Parse error", msg);
		this.location = location;
	}

	public SourceLocation getLocation() {
		return location;
	}

}
