package daddy;

import daddy.errors.TopLevelIssueContext;
import daddy.lexer.PygmyLexer;
import daddy.lexer.PygmyLexerException;
import daddy.model.ddd.VariableOrder;
import daddy.model.hom.Action;
import daddy.model.hom.Comparator;
import daddy.model.hom.Condition;
import daddy.model.hom.Hom;
import daddy.model.hom.WeightedSum;
import daddy.model.pygmy.*;
import daddy.parser.PygmyParseException;
import daddy.parser.PygmyParser;
import daddy.trans.DaddyTransException;
import daddy.trans.UnsupportedFeatureIssue;
import daddy.trans.passes.expansion.InliningPass;
import daddy.trans.passes.linear.*;
import daddy.trans.passes.parse.ParsingIssue;
import daddy.trans.passes.parse.PygmyParsingPass;
import daddy.trans.passes.scope.PygmyScopingPass;
import daddy.trans.passes.synthesis.HomSynthesizer;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry points for using the compiler as a library. Every method either succeeds or throws a
 * {@link DaddyTransException} listing all the issues found by the first failing pass.
 */
public class Daddy {
	private Daddy() {}

	private static final Path UNNAMED = Paths.get("<input>");

	private static void checkErrors(TopLevelIssueContext ctx) throws DaddyTransException {
		if (ctx.hasErrors()) {
			throw new DaddyTransException(ctx.format());
		}
	}

	/**
	 * Parses and resolves a module.
	 */
	public static PygmyModule parse(Path file, CharSequence source) throws DaddyTransException {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		PygmyUnit unit = PygmyParsingPass.perform(ctx, file, source);
		checkErrors(ctx);
		PygmyModule module = PygmyScopingPass.perform(ctx, unit);
		checkErrors(ctx);
		return module;
	}

	public static PygmyModule parse(CharSequence source) throws DaddyTransException {
		return parse(UNNAMED, source);
	}

	/**
	 * Restricts the module to the given entry functions, flattened into call-free, loop-free bodies. Without
	 * entries, every function taking no parameters is one.
	 */
	public static PygmyModule scope(PygmyModule module, List<String> entries) throws DaddyTransException {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		PygmyModule result = InliningPass.perform(ctx, module,
				entries.isEmpty() ? InliningPass.defaultEntries(module) : entries);
		checkErrors(ctx);
		return result;
	}

	/**
	 * Extracts the actions of every function of a scoped module.
	 */
	public static Map<String, List<Action>> actions(PygmyModule scoped, VariableOrder order)
			throws DaddyTransException {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		Map<String, List<Action>> result = new LinkedHashMap<>();
		for (PygmyFunc func : scoped.getFuncs().values()) {
			result.put(func.getName(), ActionExtractionPass.perform(ctx, order, func));
		}
		checkErrors(ctx);
		return result;
	}

	/**
	 * Compiles the entry functions of a source text. The variable order is the one of the whole module, so
	 * actions of different compilations of the same source agree on it.
	 */
	public static Map<String, List<Hom>> compile(CharSequence source, List<String> entries)
			throws DaddyTransException {
		PygmyModule module = parse(source);
		VariableOrder order = VariableOrder.fromModule(module);
		Map<String, List<Hom>> result = new LinkedHashMap<>();
		for (Map.Entry<String, List<Action>> entry : actions(scope(module, entries), order).entrySet()) {
			List<Hom> homs = new ArrayList<>();
			for (Action action : entry.getValue()) {
				homs.add(HomSynthesizer.synthesize(order, action));
			}
			result.put(entry.getKey(), homs);
		}
		return result;
	}

	public static Hom ass(VariableOrder order, String target, String source, boolean augment, int increment,
	                      int multiplier) {
		return HomSynthesizer.ass(order, target, source, augment, increment, multiplier);
	}

	public static Hom synthesize(VariableOrder order, List<Condition> conditions, Map<String, WeightedSum> effect) {
		return HomSynthesizer.synthesize(order, conditions, effect);
	}

	/**
	 * Compiles one line of text: an assignment such as {@code x += 2*y - 1} becomes the assignment homomorphism,
	 * a condition such as {@code x <= y + 2} becomes the action keeping only the states where it holds.
	 */
	public static Hom hom(VariableOrder order, String text) throws DaddyTransException {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		PygmyNode line;
		try {
			line = new PygmyParser(new PygmyLexer(UNNAMED, text).readTokens()).readLine();
		} catch (PygmyLexerException e) {
			ctx.error(new ParsingIssue(e.getLocation(), e.getMsg()));
			throw new DaddyTransException(ctx.format());
		} catch (PygmyParseException e) {
			ctx.error(new ParsingIssue(e.getLocation(), e.getMsg()));
			throw new DaddyTransException(ctx.format());
		}
		Map<String, LinearForm> env = new LinkedHashMap<>();
		for (String variable : order.getVariables()) {
			env.put(variable, LinearForm.variable(variable));
		}
		try {
			if (line instanceof PygmyAssign) {
				PygmyAssign assign = (PygmyAssign) line;
				String target = LinearFormExtractionVisitor.resolve(env, assign.getTarget());
				LinearForm value = assign.getValue().accept(new LinearFormExtractionVisitor(env));
				if ("+".equals(assign.getOp())) {
					value = LinearForm.variable(target).plus(value);
				} else if ("-".equals(assign.getOp())) {
					value = LinearForm.variable(target).minus(value);
				}
				return HomSynthesizer.assign(order, target, value.getCoefficients(), value.getConstant());
			}
			List<List<LinearCondition>> alternatives =
					new ConditionNormalizer(env).normalize((PygmyExpression) line);
			if (alternatives.size() > 1) {
				ctx.error(new UnsupportedFeatureIssue(line.getLocation(), "disjunction in a selector"));
				throw new DaddyTransException(ctx.format());
			}
			List<Condition> conditions = new ArrayList<>();
			if (alternatives.isEmpty()) {
				// never holds
				conditions.add(new Condition(WeightedSum.constant(0), Comparator.NE));
			} else {
				for (LinearCondition condition : alternatives.get(0)) {
					conditions.add(condition.toCondition(order));
				}
			}
			return HomSynthesizer.synthesize(order, conditions, Collections.emptyMap());
		} catch (LinearizationException e) {
			ctx.error(e.getIssue());
			throw new DaddyTransException(ctx.format());
		}
	}
}
