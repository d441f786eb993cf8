package daddy.formatters;

import daddy.model.hom.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class HomFormattingVisitor extends HomVisitor<String, RuntimeException> {

	@Override
	public String visit(IdentityHom identityHom) throws RuntimeException {
		return "id";
	}

	@Override
	public String visit(ConstHom constHom) throws RuntimeException {
		return "const(" + constHom.getVariable() + (constHom.isAugment() ? " += " : " := ") +
				constHom.getValue() + ")";
	}

	@Override
	public String visit(AssignHom assignHom) throws RuntimeException {
		return "assign(" + assignHom.getTarget() + " := " + assignHom.getSum() + ")";
	}

	@Override
	public String visit(DownHom downHom) throws RuntimeException {
		return "down(" + downHom.getTarget() + " := " + downHom.getSum() + ", " + downHom.getPending() + ")";
	}

	@Override
	public String visit(UpHom upHom) throws RuntimeException {
		return "up(" + upHom.getBuffered() + ")";
	}

	@Override
	public String visit(ActionHom actionHom) throws RuntimeException {
		List<String> guard = new ArrayList<>();
		for (Condition condition : actionHom.getAction().getGuard()) {
			guard.add(condition.toString());
		}
		List<String> effect = new ArrayList<>();
		for (Map.Entry<String, WeightedSum> assignment : actionHom.getAction().getEffect().entrySet()) {
			// unchanged variables are left out
			if (!assignment.getValue().equals(WeightedSum.identity(assignment.getKey()))) {
				effect.add(assignment.getKey() + " := " + assignment.getValue());
			}
		}
		return "action([" + String.join(", ", guard) + "] -> {" + String.join(", ", effect) + "})";
	}

	@Override
	public String visit(ComposeHom composeHom) throws RuntimeException {
		return composeHom.getOuter().accept(this) + " * " + composeHom.getInner().accept(this);
	}

}
