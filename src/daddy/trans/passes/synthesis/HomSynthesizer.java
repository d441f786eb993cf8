package daddy.trans.passes.synthesis;

import daddy.InternalCompilerError;
import daddy.model.ddd.VariableOrder;
import daddy.model.hom.*;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds homomorphisms for assignments and guarded actions over a fixed variable order.
 *
 * Every assignment is realised by one representation, {@link AssignHom} over a {@link WeightedSum}; the
 * identity and constant cases are only shortcuts for sums that do not need to look at other variables.
 */
public class HomSynthesizer {
	private HomSynthesizer() {}

	private static void checkVariable(VariableOrder order, String variable) {
		if (!order.contains(variable)) {
			throw new InternalCompilerError("'" + variable + "' is not a state variable");
		}
	}

	/**
	 * {@code target (+)= multiplier * source + increment}
	 */
	public static Hom ass(VariableOrder order, String target, String source, boolean augment, int increment,
	                      int multiplier) {
		checkVariable(order, target);
		checkVariable(order, source);
		if (multiplier == 0) {
			if (increment == 0 && augment) {
				return IdentityHom.INSTANCE;
			}
			return new ConstHom(target, increment, augment);
		}
		Map<String, Integer> coefficients = new HashMap<>();
		coefficients.put(source, multiplier);
		if (augment) {
			coefficients.merge(target, 1, Integer::sum);
		}
		return assign(order, target, coefficients, increment);
	}

	/**
	 * {@code target := sum of coefficient * variable + constant}
	 */
	public static Hom assign(VariableOrder order, String target, Map<String, Integer> coefficients, int constant) {
		checkVariable(order, target);
		WeightedSum sum = WeightedSum.of(order, coefficients, constant);
		Map<String, Integer> terms = sum.getCoefficients();
		if (terms.isEmpty()) {
			return new ConstHom(target, constant, false);
		}
		if (terms.size() == 1 && terms.getOrDefault(target, 0) == 1) {
			if (constant == 0) {
				return IdentityHom.INSTANCE;
			}
			return new ConstHom(target, constant, true);
		}
		return new AssignHom(target, sum);
	}

	/**
	 * Builds the single-pass homomorphism of a guarded action. Variables missing from the effect keep their value.
	 */
	public static Hom synthesize(VariableOrder order, List<Condition> conditions, Map<String, WeightedSum> effect) {
		Map<String, WeightedSum> complete = new LinkedHashMap<>();
		for (String variable : order.getVariables()) {
			complete.put(variable, effect.getOrDefault(variable, WeightedSum.identity(variable)));
		}
		for (String variable : effect.keySet()) {
			checkVariable(order, variable);
		}
		return new ActionHom(new Action(conditions, complete));
	}

	public static Hom synthesize(VariableOrder order, Action action) {
		return synthesize(order, action.getGuard(), action.getEffect());
	}

	/**
	 * @return the homomorphism applying the given ones in list order
	 */
	public static Hom sequence(List<Hom> homs) {
		Hom result = IdentityHom.INSTANCE;
		for (Hom hom : homs) {
			result = hom.compose(result);
		}
		return result;
	}

}
