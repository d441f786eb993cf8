package daddy.trans.passes.expansion;

import daddy.model.pygmy.*;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects the roots of all lookups in a flat body, in order of first appearance.
 */
public class PygmyNameCollectionVisitor extends PygmyExpressionVisitor<Void, RuntimeException> {

	private final Set<String> names;

	private PygmyNameCollectionVisitor(Set<String> names) {
		this.names = names;
	}

	public static Set<String> collect(List<PygmyStatement> body) {
		Set<String> names = new LinkedHashSet<>();
		collect(body, new PygmyNameCollectionVisitor(names));
		return names;
	}

	private static void collect(List<PygmyStatement> body, PygmyNameCollectionVisitor v) {
		for (PygmyStatement statement : body) {
			if (statement instanceof PygmyAssign) {
				((PygmyAssign) statement).getTarget().accept(v);
				((PygmyAssign) statement).getValue().accept(v);
			} else if (statement instanceof PygmyIf) {
				((PygmyIf) statement).getCondition().accept(v);
				collect(((PygmyIf) statement).getThen(), v);
				collect(((PygmyIf) statement).getOrElse(), v);
			} else if (statement instanceof PygmyFor) {
				((PygmyFor) statement).getIterable().accept(v);
				collect(((PygmyFor) statement).getBody(), v);
			} else if (statement instanceof PygmyReturn && ((PygmyReturn) statement).hasValue()) {
				((PygmyReturn) statement).getValue().accept(v);
			} else if (statement instanceof PygmyBareCall) {
				((PygmyBareCall) statement).getCall().accept(v);
			}
		}
	}

	@Override
	public Void visit(PygmyConst pygmyConst) throws RuntimeException {
		return null;
	}

	@Override
	public Void visit(PygmyName pygmyName) throws RuntimeException {
		names.add(pygmyName.getId());
		return null;
	}

	@Override
	public Void visit(PygmyAttr pygmyAttr) throws RuntimeException {
		return pygmyAttr.getValue().accept(this);
	}

	@Override
	public Void visit(PygmyItem pygmyItem) throws RuntimeException {
		pygmyItem.getValue().accept(this);
		return pygmyItem.getItem().accept(this);
	}

	@Override
	public Void visit(PygmyOp pygmyOp) throws RuntimeException {
		for (PygmyExpression child : pygmyOp.getChildren()) {
			child.accept(this);
		}
		return null;
	}

	@Override
	public Void visit(PygmyCall pygmyCall) throws RuntimeException {
		pygmyCall.getFunction().accept(this);
		for (PygmyExpression arg : pygmyCall.getArguments()) {
			arg.accept(this);
		}
		return null;
	}

	@Override
	public Void visit(PygmySequence pygmySequence) throws RuntimeException {
		for (PygmyExpression element : pygmySequence.getElements()) {
			element.accept(this);
		}
		return null;
	}

}
