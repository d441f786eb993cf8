package daddy.trans.passes.option;

import daddy.DaddyOptionException;
import daddy.DaddyOptions;
import daddy.errors.IssueContext;

import java.util.logging.Level;
import java.util.logging.Logger;

public class OptionParsingPass {
	private OptionParsingPass() {}

	public static DaddyOptions perform(IssueContext ctx, Logger logger, String[] args) {
		DaddyOptions opts = new DaddyOptions(args);
		try {
			opts.parse();
		} catch (DaddyOptionException e) {
			ctx.error(new OptionParserIssue(e.getMsg()));
		}
		// set the logger's log level based on command line arguments
		if (opts.logLvlQuiet) {
			logger.setLevel(Level.WARNING);
		} else if (opts.logLvlVerbose) {
			logger.setLevel(Level.FINE);
		} else {
			logger.setLevel(Level.INFO);
		}
		return opts;
	}
}
