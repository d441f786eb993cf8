package daddy.model.hom;

import daddy.InternalCompilerError;
import daddy.model.ddd.Diagram;
import daddy.model.ddd.Edge;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Applies a homomorphism to one diagram. Each variant walks the path with a loop, so the only recursion is
 * through {@link ComposeHom} and the hand-over from an assignment to its {@link DownHom} and {@link UpHom}.
 */
public class HomEvaluator extends HomVisitor<Diagram, RuntimeException> {

	private final Diagram diagram;

	private HomEvaluator(Diagram diagram) {
		this.diagram = diagram;
	}

	public static Diagram apply(Hom hom, Diagram diagram) {
		if (diagram.isNull()) {
			return diagram;
		}
		return hom.accept(new HomEvaluator(diagram));
	}

	private static Diagram rebuild(List<Edge> prefix, Diagram rest) {
		Diagram result = rest;
		for (int i = prefix.size() - 1; i >= 0; i--) {
			result = result.prepend(prefix.get(i));
		}
		return result;
	}

	@Override
	public Diagram visit(IdentityHom identityHom) throws RuntimeException {
		return diagram;
	}

	@Override
	public Diagram visit(ConstHom constHom) throws RuntimeException {
		List<Edge> prefix = new ArrayList<>();
		Diagram current = diagram;
		while (!current.isOne()) {
			Edge edge = current.getHead();
			if (edge.getVariable().equals(constHom.getVariable())) {
				int value = constHom.isAugment() ?
						Math.addExact(edge.getValue(), constHom.getValue()) : constHom.getValue();
				return rebuild(prefix, current.getTail().prepend(edge.withValue(value)));
			}
			prefix.add(edge);
			current = current.getTail();
		}
		return diagram;
	}

	@Override
	public Diagram visit(AssignHom assignHom) throws RuntimeException {
		String target = assignHom.getTarget();
		WeightedSum sum = assignHom.getSum();
		List<Edge> prefix = new ArrayList<>();
		Diagram current = diagram;
		while (!current.isOne()) {
			Edge edge = current.getHead();
			sum = sum.feed(edge.getVariable(), edge.getValue());
			if (edge.getVariable().equals(target)) {
				Diagram rest = current.getTail();
				if (sum.isDone()) {
					return rebuild(prefix, rest.prepend(edge.withValue(sum.value())));
				}
				return rebuild(prefix, apply(new DownHom(target, sum, new ArrayList<>()), rest));
			}
			prefix.add(edge);
			current = current.getTail();
		}
		throw new InternalCompilerError("assignment target '" + target + "' is not on the path");
	}

	@Override
	public Diagram visit(DownHom downHom) throws RuntimeException {
		WeightedSum sum = downHom.getSum();
		List<Edge> pending = new ArrayList<>(downHom.getPending());
		Diagram current = diagram;
		while (!sum.isDone()) {
			if (current.isOne()) {
				throw new InternalCompilerError("path ended before " + sum + " was resolved");
			}
			Edge edge = current.getHead();
			sum = sum.feed(edge.getVariable(), edge.getValue());
			pending.add(edge);
			current = current.getTail();
		}
		Diagram emitted = current.prepend(new Edge(downHom.getTarget(), sum.value()));
		return apply(new UpHom(pending), emitted);
	}

	@Override
	public Diagram visit(UpHom upHom) throws RuntimeException {
		if (diagram.isOne()) {
			throw new InternalCompilerError("nothing to hoist above " + upHom.getBuffered());
		}
		List<Edge> prefix = new ArrayList<>();
		prefix.add(diagram.getHead());
		prefix.addAll(upHom.getBuffered());
		return rebuild(prefix, diagram.getTail());
	}

	@Override
	public Diagram visit(ActionHom actionHom) throws RuntimeException {
		List<Condition> guard = new ArrayList<>();
		for (Condition condition : actionHom.getAction().getGuard()) {
			if (condition.isDone()) {
				if (!condition.holds()) {
					return diagram.nullDiagram();
				}
			} else {
				guard.add(condition);
			}
		}
		Map<String, WeightedSum> effect = new LinkedHashMap<>(actionHom.getAction().getEffect());
		Set<String> seen = new HashSet<>();
		List<Edge> edges = new ArrayList<>();
		Diagram current = diagram;
		while (!current.isOne()) {
			Edge edge = current.getHead();
			String variable = edge.getVariable();
			for (int i = 0; i < guard.size(); i++) {
				Condition condition = guard.get(i).feed(variable, edge.getValue());
				if (condition.isDone() && !condition.holds()) {
					return diagram.nullDiagram();
				}
				guard.set(i, condition);
			}
			for (Map.Entry<String, WeightedSum> assignment : effect.entrySet()) {
				assignment.setValue(assignment.getValue().feed(variable, edge.getValue()));
			}
			seen.add(variable);
			edges.add(edge);
			current = current.getTail();
		}
		for (Condition condition : guard) {
			if (!condition.holds()) {
				return diagram.nullDiagram();
			}
		}
		if (!seen.containsAll(effect.keySet())) {
			throw new InternalCompilerError("effect on variables missing from the path: " + effect.keySet());
		}
		List<Edge> result = new ArrayList<>();
		for (Edge edge : edges) {
			WeightedSum sum = effect.get(edge.getVariable());
			result.add(sum == null ? edge : edge.withValue(sum.value()));
		}
		return rebuild(result, current);
	}

	@Override
	public Diagram visit(ComposeHom composeHom) throws RuntimeException {
		return apply(composeHom.getOuter(), apply(composeHom.getInner(), diagram));
	}

}
