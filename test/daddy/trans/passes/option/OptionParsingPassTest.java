package daddy.trans.passes.option;

import daddy.DaddyOptions;
import daddy.errors.Issue;
import daddy.errors.TopLevelIssueContext;
import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class OptionParsingPassTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	@Test
	public void setsLogLevel() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		Logger logger = Logger.getLogger("OptionParsingPassTest");

		DaddyOptions opts = OptionParsingPass.perform(ctx, logger, new String[]{"-q", "model.py"});
		assertFalse(ctx.hasErrors());
		assertTrue(opts.logLvlQuiet);
		assertThat(logger.getLevel(), is(Level.WARNING));

		OptionParsingPass.perform(ctx, logger, new String[]{"-v", "model.py"});
		assertThat(logger.getLevel(), is(Level.FINE));

		OptionParsingPass.perform(ctx, logger, new String[]{"model.py"});
		assertThat(logger.getLevel(), is(Level.INFO));
	}

	@Test
	public void reportsBadConfiguration() throws IOException {
		File config = folder.newFile("config.json");
		FileUtils.writeStringToFile(config, "[1, 2]", StandardCharsets.UTF_8);
		TopLevelIssueContext ctx = new TopLevelIssueContext();

		OptionParsingPass.perform(ctx, Logger.getLogger("OptionParsingPassTest"),
				new String[]{"-c", config.getPath(), "model.py"});

		assertTrue(ctx.hasErrors());
		List<Issue> issues = ctx.getIssues();
		assertThat(issues.size(), is(1));
		assertThat(issues.get(0), instanceOf(OptionParserIssue.class));
		assertTrue(((OptionParserIssue) issues.get(0)).getReason().startsWith(config.getPath()));
	}

}
