package daddy;

import daddy.errors.TopLevelIssueContext;
import daddy.formatters.IndentingWriter;
import daddy.formatters.PygmyNodeFormattingVisitor;
import daddy.model.ddd.PathSet;
import daddy.model.ddd.VariableOrder;
import daddy.model.hom.Action;
import daddy.model.hom.Hom;
import daddy.model.pygmy.PygmyFunc;
import daddy.model.pygmy.PygmyModule;
import daddy.model.pygmy.PygmyUnit;
import daddy.trans.DaddyTransException;
import daddy.trans.passes.expansion.InliningPass;
import daddy.trans.passes.json.ActionJsonSerializer;
import daddy.trans.passes.linear.ActionExtractionPass;
import daddy.trans.passes.option.OptionParsingPass;
import daddy.trans.passes.parse.IOErrorIssue;
import daddy.trans.passes.parse.PygmyParsingPass;
import daddy.trans.passes.scope.PygmyScopingPass;
import daddy.trans.passes.synthesis.HomSynthesizer;
import org.apache.commons.io.FileUtils;

import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

public class DaddyMain {
	private String[] cmdArgs;
	private static Logger logger;

	public DaddyMain(String[] args) {
		cmdArgs = args;
		// Get the top Logger instance
		logger = Logger.getLogger("DaddyMain");
	}

	// Creates a DaddyMain instance, and initiates run() below.
	public static void main(String[] args) {
		if (new DaddyMain(args).run()) {
			logger.info("Finished");
		} else {
			logger.info("Terminated with errors");
		}
	}

	private static void printModule(PygmyModule module) throws IOException {
		IndentingWriter out = new IndentingWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
		module.accept(new PygmyNodeFormattingVisitor(out));
		out.newLine();
		out.flush();
	}

	Map<String, List<Hom>> compilePipeline(TopLevelIssueContext ctx, DaddyOptions opts, Path inputFilePath,
	                                       String inputFileContents) throws DaddyTransException, IOException {
		logger.info("Parsing pygmy module");
		PygmyUnit unit = PygmyParsingPass.perform(ctx, inputFilePath, inputFileContents);
		checkErrors(ctx);

		logger.info("Building module");
		PygmyModule module = PygmyScopingPass.perform(ctx, unit);
		checkErrors(ctx);

		List<String> entries = opts.entries.isEmpty() ? InliningPass.defaultEntries(module) : opts.entries;
		logger.info("Inlining entry functions " + entries);
		PygmyModule scoped = InliningPass.perform(ctx, module, entries);
		checkErrors(ctx);

		if (opts.print) {
			printModule(scoped);
		}

		VariableOrder order = VariableOrder.fromModule(module);
		logger.fine("Variable order: " + order);

		logger.info("Extracting actions");
		Map<String, List<Action>> actions = new LinkedHashMap<>();
		for (PygmyFunc func : scoped.getFuncs().values()) {
			List<Action> funcActions = ActionExtractionPass.perform(ctx, order, func);
			logger.fine("Entry '" + func.getName() + "': " + funcActions.size() + " action(s)");
			actions.put(func.getName(), funcActions);
		}
		checkErrors(ctx);

		logger.info("Synthesizing homomorphisms");
		Map<String, List<Hom>> homs = new LinkedHashMap<>();
		for (Map.Entry<String, List<Action>> entry : actions.entrySet()) {
			List<Hom> entryHoms = new ArrayList<>();
			for (Action action : entry.getValue()) {
				Hom hom = HomSynthesizer.synthesize(order, action);
				logger.fine(entry.getKey() + ": " + hom);
				entryHoms.add(hom);
			}
			homs.put(entry.getKey(), entryHoms);
		}

		if (opts.outputFilePath != null) {
			logger.info("Writing actions to \"" + opts.outputFilePath + "\"");
			FileUtils.writeStringToFile(new File(opts.outputFilePath),
					ActionJsonSerializer.serialize(order, actions).toString(2), StandardCharsets.UTF_8);
		}

		if (opts.explore) {
			logger.info("Exploring the state space");
			List<Hom> all = new ArrayList<>();
			homs.values().forEach(all::addAll);
			PathSet reachable = PathSet.of(VariableOrder.initialState(module)).reachable(all);
			System.out.println(reachable.size() + " reachable state(s)");
		}
		return homs;
	}

	// Top-level workhorse method.
	public boolean run() {
		try {
			TopLevelIssueContext ctx = new TopLevelIssueContext();

			// Check options, set up logging.
			DaddyOptions opts = OptionParsingPass.perform(ctx, logger, cmdArgs);
			if (ctx.hasErrors()) {
				System.err.println(ctx.format());
				opts.printHelp();
				return false;
			}

			logger.info("Opening source file");
			Path inputFilePath = Paths.get(opts.inputFilePath);
			String inputFileContents;
			try {
				inputFileContents = FileUtils.readFileToString(inputFilePath.toFile(), StandardCharsets.UTF_8);
			} catch (IOException e) {
				ctx.error(new IOErrorIssue(e));
				inputFileContents = null;
			}
			checkErrors(ctx);

			compilePipeline(ctx, opts, inputFilePath, inputFileContents);
		} catch (DaddyTransException | IOException e) {
			logger.severe("found issues");
			System.err.println(e.getMessage());
			return false;
		}

		return true;
	}

	private static void checkErrors(TopLevelIssueContext ctx) throws DaddyTransException {
		if (ctx.hasErrors()) {
			throw new DaddyTransException(ctx.format());
		}
	}
}
