package daddy.trans.passes.expansion;

import daddy.model.pygmy.PygmyFor;
import daddy.model.pygmy.PygmyIf;
import daddy.model.pygmy.PygmyReturn;
import daddy.model.pygmy.PygmyStatement;

import java.util.ArrayList;
import java.util.List;

/**
 * Moves the statements following an {@code if} into those of its branches that fall through, whenever one of its
 * branches returns. Afterwards a return is always the last statement of its block, and the statements after it
 * are gone.
 *
 * Expects a loop-free body.
 */
public class PygmyReturnNormalizer {
	private PygmyReturnNormalizer() {}

	public static List<PygmyStatement> normalize(List<PygmyStatement> block) {
		List<PygmyStatement> result = new ArrayList<>();
		for (int i = 0; i < block.size(); i++) {
			PygmyStatement statement = block.get(i);
			if (statement instanceof PygmyReturn) {
				result.add(statement);
				return result;
			}
			if (statement instanceof PygmyIf && containsReturn(statement)) {
				PygmyIf pygmyIf = (PygmyIf) statement;
				List<PygmyStatement> rest = block.subList(i + 1, block.size());
				result.add(new PygmyIf(pygmyIf.getLocation(), pygmyIf.getCondition(),
						normalizeBranch(pygmyIf.getThen(), rest), normalizeBranch(pygmyIf.getOrElse(), rest)));
				return result;
			}
			result.add(statement);
		}
		return result;
	}

	private static List<PygmyStatement> normalizeBranch(List<PygmyStatement> branch, List<PygmyStatement> rest) {
		List<PygmyStatement> normalized = normalize(branch);
		if (alwaysReturns(normalized)) {
			return normalized;
		}
		List<PygmyStatement> continued = new ArrayList<>(normalized);
		continued.addAll(rest);
		return normalize(continued);
	}

	public static boolean containsReturn(PygmyStatement statement) {
		if (statement instanceof PygmyReturn) {
			return true;
		} else if (statement instanceof PygmyIf) {
			PygmyIf pygmyIf = (PygmyIf) statement;
			return pygmyIf.getThen().stream().anyMatch(PygmyReturnNormalizer::containsReturn) ||
					pygmyIf.getOrElse().stream().anyMatch(PygmyReturnNormalizer::containsReturn);
		} else if (statement instanceof PygmyFor) {
			return ((PygmyFor) statement).getBody().stream().anyMatch(PygmyReturnNormalizer::containsReturn);
		}
		return false;
	}

	public static boolean returnsValue(PygmyStatement statement) {
		if (statement instanceof PygmyReturn) {
			return ((PygmyReturn) statement).hasValue();
		} else if (statement instanceof PygmyIf) {
			PygmyIf pygmyIf = (PygmyIf) statement;
			return pygmyIf.getThen().stream().anyMatch(PygmyReturnNormalizer::returnsValue) ||
					pygmyIf.getOrElse().stream().anyMatch(PygmyReturnNormalizer::returnsValue);
		} else if (statement instanceof PygmyFor) {
			return ((PygmyFor) statement).getBody().stream().anyMatch(PygmyReturnNormalizer::returnsValue);
		}
		return false;
	}

	/**
	 * @return whether every path through a normalized block ends with a return
	 */
	public static boolean alwaysReturns(List<PygmyStatement> block) {
		if (block.isEmpty()) {
			return false;
		}
		PygmyStatement last = block.get(block.size() - 1);
		if (last instanceof PygmyReturn) {
			return true;
		} else if (last instanceof PygmyIf) {
			return alwaysReturns(((PygmyIf) last).getThen()) && alwaysReturns(((PygmyIf) last).getOrElse());
		}
		return false;
	}

}
