package daddy;

import org.apache.commons.io.FileUtils;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.plumelib.options.Option;
import org.plumelib.options.Options;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

public class DaddyOptions {
	public static final String VERSION = "0.1.0";

	@Option(value = "Version", aliases = {"-version"})
	public boolean version = false;

	@Option(value = "-h Print usage information", aliases = {"-help"})
	public boolean help = false;

	@Option(value = "-q Reduce printing during execution", aliases = {"-quiet"})
	public boolean logLvlQuiet = false;

	/**
	 * Be verbose, print extra detailed information. Sets the log level to FINE.
	 */
	@Option(value = "-v Print detailed information during execution", aliases = {"-verbose"})
	public boolean logLvlVerbose = false;

	@Option("-c path to the configuration file, if any")
	public String configFilePath;

	@Option(value = "-e entry function(s) to compile, comma separated", aliases = {"-entry"})
	public List<String> entryArgs = new ArrayList<>();

	@Option(value = "-p Print the flattened code of each entry function", aliases = {"-print"})
	public boolean print = false;

	@Option(value = "-o path of the JSON file the compiled actions are written to", aliases = {"-output"})
	public String outputFilePath;

	@Option(value = "-x Explore the states reachable from the initial state", aliases = {"-explore"})
	public boolean explore = false;

	public String inputFilePath;

	// entry functions from the command line, or else from the configuration file; empty means all
	public List<String> entries = new ArrayList<>();

	private Options plumeOptions;
	private String[] remainingArgs;

	public void printHelp() {
		plumeOptions.printUsage();
	}

	public DaddyOptions(String[] args) {
		plumeOptions = new Options("daddy [options] model.py", this);
		remainingArgs = plumeOptions.parse(true, args);
	}

	private static List<String> splitEntries(List<String> args) {
		List<String> result = new ArrayList<>();
		for (String arg : args) {
			for (String entry : arg.split(",")) {
				if (!entry.trim().isEmpty()) {
					result.add(entry.trim());
				}
			}
		}
		return result;
	}

	public void parse() throws DaddyOptionException {
		if (version) {
			System.out.println("daddy version " + VERSION);
			System.exit(0);
		}

		if (help || remainingArgs.length != 1) {
			printHelp();
			System.exit(0);
		}

		inputFilePath = remainingArgs[0];
		entries = splitEntries(entryArgs);

		if (configFilePath == null || configFilePath.isEmpty()) {
			return;
		}

		String s;

		try {
			s = FileUtils.readFileToString(new File(configFilePath), StandardCharsets.UTF_8);
		} catch (IOException ex) {
			throw new DaddyOptionException("Error reading configuration file: " + ex.getMessage());
		}

		JSONObject config;

		try {
			config = new JSONObject(s);
			if (entries.isEmpty() && config.has("entries")) {
				JSONArray configEntries = config.getJSONArray("entries");
				for (int i = 0; i < configEntries.length(); i++) {
					entries.add(configEntries.getString(i));
				}
			}
			if (outputFilePath == null && config.has("output")) {
				outputFilePath = config.getString("output");
			}
		} catch (JSONException e) {
			throw new DaddyOptionException(configFilePath + ": parsing error: " + e.getMessage());
		}
	}
}
