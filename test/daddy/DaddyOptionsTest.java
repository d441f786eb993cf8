package daddy;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class DaddyOptionsTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private File config(String contents) throws IOException {
		File file = folder.newFile("config.json");
		FileUtils.writeStringToFile(file, contents, StandardCharsets.UTF_8);
		return file;
	}

	@Test
	public void commandLine() {
		DaddyOptions opts = new DaddyOptions(new String[]{"-e", "take0,take1", "-e", "reset", "-p", "-v",
				"model.py"});
		opts.parse();
		assertThat(opts.inputFilePath, is("model.py"));
		assertThat(opts.entries, is(Arrays.asList("take0", "take1", "reset")));
		assertTrue(opts.print);
		assertTrue(opts.logLvlVerbose);
		assertThat(opts.outputFilePath, nullValue());
	}

	@Test
	public void configurationFile() throws IOException {
		File file = config("{\"entries\": [\"take0\"], \"output\": \"actions.json\"}");
		DaddyOptions opts = new DaddyOptions(new String[]{"-c", file.getPath(), "model.py"});
		opts.parse();
		assertThat(opts.entries, is(Collections.singletonList("take0")));
		assertThat(opts.outputFilePath, is("actions.json"));
	}

	@Test
	public void commandLineWins() throws IOException {
		File file = config("{\"entries\": [\"take0\"], \"output\": \"actions.json\"}");
		DaddyOptions opts = new DaddyOptions(new String[]{"-c", file.getPath(), "-e", "take1", "-o", "out.json",
				"model.py"});
		opts.parse();
		assertThat(opts.entries, is(Collections.singletonList("take1")));
		assertThat(opts.outputFilePath, is("out.json"));
	}

	@Test(expected = DaddyOptionException.class)
	public void malformedConfiguration() throws IOException {
		File file = config("{\"entries\": ");
		new DaddyOptions(new String[]{"-c", file.getPath(), "model.py"}).parse();
	}

}
