package daddy.trans.passes.linear;

import daddy.model.pygmy.*;
import daddy.trans.passes.scope.PygmyBuiltinModule;

import java.util.Map;

/**
 * Computes the linear form of a value expression, reading variables through an environment that maps each
 * variable to its current value as a linear form.
 */
public class LinearFormExtractionVisitor extends PygmyExpressionVisitor<LinearForm, LinearizationException> {

	private final Map<String, LinearForm> env;

	public LinearFormExtractionVisitor(Map<String, LinearForm> env) {
		this.env = env;
	}

	/**
	 * @return the name of the scalar component the lookup denotes, such as {@code ps[1].f}; negative indices count
	 * from the end of the array
	 */
	private static String variableName(Map<String, LinearForm> env, PygmyLookup lookup)
			throws LinearizationException {
		if (lookup instanceof PygmyName) {
			return ((PygmyName) lookup).getId();
		} else if (lookup instanceof PygmyAttr) {
			PygmyAttr attr = (PygmyAttr) lookup;
			return variableName(env, attr.getValue()) + "." + attr.getAttr();
		}
		PygmyItem item = (PygmyItem) lookup;
		if (!(item.getItem() instanceof PygmyConst) || ((PygmyConst) item.getItem()).isBoolean()) {
			throw new LinearizationException(new NonLinearExpressionIssue(item,
					"index must be an integer known at compile time"));
		}
		String array = variableName(env, item.getValue());
		int index = ((PygmyConst) item.getItem()).asInt();
		if (index < 0) {
			index += length(env, array);
		}
		return array + "[" + index + "]";
	}

	private static boolean hasComponent(Map<String, LinearForm> env, String component) {
		if (env.containsKey(component)) {
			return true;
		}
		for (String name : env.keySet()) {
			if (name.startsWith(component + ".") || name.startsWith(component + "[")) {
				return true;
			}
		}
		return false;
	}

	private static int length(Map<String, LinearForm> env, String array) {
		int length = 0;
		while (hasComponent(env, array + "[" + length + "]")) {
			length++;
		}
		return length;
	}

	public static String resolve(Map<String, LinearForm> env, PygmyLookup lookup) throws LinearizationException {
		String name = variableName(env, lookup);
		if (!env.containsKey(name)) {
			throw new LinearizationException(new UnknownStateVariableIssue(lookup, name));
		}
		return name;
	}

	private LinearForm read(PygmyLookup lookup) throws LinearizationException {
		return env.get(resolve(env, lookup));
	}

	private static LinearForm exactly(PygmyExpression expression, ArithmeticOperation operation)
			throws LinearizationException {
		try {
			return operation.perform();
		} catch (ArithmeticException e) {
			throw new LinearizationException(new NonLinearExpressionIssue(expression, "integer overflow"));
		}
	}

	@FunctionalInterface
	private interface ArithmeticOperation {
		LinearForm perform() throws LinearizationException;
	}

	@Override
	public LinearForm visit(PygmyConst pygmyConst) throws LinearizationException {
		return LinearForm.constant(pygmyConst.asInt());
	}

	@Override
	public LinearForm visit(PygmyName pygmyName) throws LinearizationException {
		return read(pygmyName);
	}

	@Override
	public LinearForm visit(PygmyAttr pygmyAttr) throws LinearizationException {
		return read(pygmyAttr);
	}

	@Override
	public LinearForm visit(PygmyItem pygmyItem) throws LinearizationException {
		return read(pygmyItem);
	}

	@Override
	public LinearForm visit(PygmyOp pygmyOp) throws LinearizationException {
		String op = pygmyOp.getOp();
		if (pygmyOp.getChildren().size() == 1) {
			LinearForm operand = pygmyOp.getChildren().get(0).accept(this);
			switch (op) {
				case "-":
					return exactly(pygmyOp, operand::negate);
				case "+":
					return operand;
				default:
					throw new LinearizationException(new NonLinearExpressionIssue(pygmyOp,
							"operator '" + op + "' used as a value"));
			}
		}
		if (!op.equals("+") && !op.equals("-") && !op.equals("*")) {
			throw new LinearizationException(new NonLinearExpressionIssue(pygmyOp,
					"operator '" + op + "' used as a value"));
		}
		LinearForm left = pygmyOp.getChildren().get(0).accept(this);
		LinearForm right = pygmyOp.getChildren().get(1).accept(this);
		switch (op) {
			case "+":
				return exactly(pygmyOp, () -> left.plus(right));
			case "-":
				return exactly(pygmyOp, () -> left.minus(right));
			default:
				if (left.isConstant()) {
					return exactly(pygmyOp, () -> right.scale(left.getConstant()));
				} else if (right.isConstant()) {
					return exactly(pygmyOp, () -> left.scale(right.getConstant()));
				}
				throw new LinearizationException(new NonLinearExpressionIssue(pygmyOp,
						"product of two variables"));
		}
	}

	@Override
	public LinearForm visit(PygmyCall pygmyCall) throws LinearizationException {
		PygmyLookup function = pygmyCall.getFunction();
		if (function instanceof PygmyAttr && ((PygmyAttr) function).getAttr().equals("int") &&
				((PygmyAttr) function).getValue().equals(new PygmyName(function.getLocation(), PygmyBuiltinModule.NAME)) &&
				pygmyCall.getArguments().size() == 1) {
			return pygmyCall.getArguments().get(0).accept(this);
		}
		throw new LinearizationException(new NonLinearExpressionIssue(pygmyCall, "call used as a value"));
	}

	@Override
	public LinearForm visit(PygmySequence pygmySequence) throws LinearizationException {
		throw new LinearizationException(new NonLinearExpressionIssue(pygmySequence, "sequence used as a value"));
	}

}
