package daddy.trans.passes.scope;

import daddy.model.pygmy.*;
import daddy.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Evaluates an expression at compile time against an environment of compile-time values.
 *
 * Values are Integer, Boolean, unmodifiable Lists of values, {@link PygmyType}, {@link PygmyBuiltinFunction} and
 * {@link PygmyBuiltinModule}. Arithmetic and comparisons follow the host language, booleans counting as 0 and 1.
 */
public class StaticEvaluator extends PygmyExpressionVisitor<Object, StaticEvaluationException> {

	private final Map<String, Object> env;

	public StaticEvaluator(Map<String, Object> env) {
		this.env = env;
	}

	public Object evaluate(PygmyExpression expression) throws StaticEvaluationException {
		return expression.accept(this);
	}

	public static boolean isScalar(Object value) {
		return value instanceof Integer || value instanceof Boolean;
	}

	public static boolean isData(Object value) {
		if (isScalar(value)) {
			return true;
		}
		if (value instanceof List) {
			for (Object item : (List<?>) value) {
				if (!isData(item)) {
					return false;
				}
			}
			return true;
		}
		return false;
	}

	public static boolean truthy(Object value) {
		if (value instanceof Boolean) {
			return (Boolean) value;
		} else if (value instanceof Integer) {
			return (Integer) value != 0;
		} else if (value instanceof List) {
			return !((List<?>) value).isEmpty();
		}
		return true;
	}

	public static int asInt(SourceLocation location, Object value) throws StaticEvaluationException {
		if (value instanceof Integer) {
			return (Integer) value;
		} else if (value instanceof Boolean) {
			return (Boolean) value ? 1 : 0;
		}
		throw new StaticEvaluationException(location, "expected an integer but found " + describe(value));
	}

	public static String describe(Object value) {
		if (value instanceof List) {
			return "a sequence";
		} else if (value instanceof PygmyType) {
			return "type '" + value + "'";
		} else if (value instanceof PygmyBuiltinFunction) {
			return "function '" + ((PygmyBuiltinFunction) value).getName() + "'";
		} else if (value instanceof PygmyBuiltinModule) {
			return "module '" + PygmyBuiltinModule.NAME + "'";
		}
		return "'" + value + "'";
	}

	/**
	 * @return the expression denoting a data value (scalar or sequence), or null for any other value
	 */
	public static PygmyExpression asExpression(SourceLocation location, Object value) {
		if (value instanceof Integer) {
			return new PygmyConst(location, (Integer) value);
		} else if (value instanceof Boolean) {
			return new PygmyConst(location, (Boolean) value);
		} else if (value instanceof List) {
			List<PygmyExpression> elements = new ArrayList<>();
			for (Object item : (List<?>) value) {
				PygmyExpression element = asExpression(location, item);
				if (element == null) {
					return null;
				}
				elements.add(element);
			}
			return new PygmySequence(location, elements);
		}
		return null;
	}

	@Override
	public Object visit(PygmyConst pygmyConst) throws StaticEvaluationException {
		return pygmyConst.getValue();
	}

	@Override
	public Object visit(PygmyName pygmyName) throws StaticEvaluationException {
		if (!env.containsKey(pygmyName.getId())) {
			throw new StaticEvaluationException(pygmyName.getLocation(),
					"'" + pygmyName.getId() + "' is not a compile-time constant");
		}
		return env.get(pygmyName.getId());
	}

	@Override
	public Object visit(PygmyAttr pygmyAttr) throws StaticEvaluationException {
		Object value = pygmyAttr.getValue().accept(this);
		if (value instanceof PygmyBuiltinModule) {
			Object export = ((PygmyBuiltinModule) value).getExports().get(pygmyAttr.getAttr());
			if (export == null) {
				throw new StaticEvaluationException(pygmyAttr.getLocation(),
						"module '" + PygmyBuiltinModule.NAME + "' has no member '" + pygmyAttr.getAttr() + "'");
			}
			return export;
		}
		throw new StaticEvaluationException(pygmyAttr.getLocation(),
				describe(value) + " has no attribute '" + pygmyAttr.getAttr() + "'");
	}

	@Override
	public Object visit(PygmyItem pygmyItem) throws StaticEvaluationException {
		Object value = pygmyItem.getValue().accept(this);
		if (!(value instanceof List)) {
			throw new StaticEvaluationException(pygmyItem.getLocation(), describe(value) + " cannot be indexed");
		}
		List<?> list = (List<?>) value;
		int index = asInt(pygmyItem.getItem().getLocation(), pygmyItem.getItem().accept(this));
		int actual = index < 0 ? list.size() + index : index;
		if (actual < 0 || actual >= list.size()) {
			throw new StaticEvaluationException(pygmyItem.getItem().getLocation(),
					"index " + index + " out of range");
		}
		return list.get(actual);
	}

	@Override
	public Object visit(PygmyOp pygmyOp) throws StaticEvaluationException {
		List<PygmyExpression> children = pygmyOp.getChildren();
		SourceLocation location = pygmyOp.getLocation();
		switch (pygmyOp.getOp()) {
			case "and": {
				Object result = Boolean.TRUE;
				for (PygmyExpression child : children) {
					result = child.accept(this);
					if (!truthy(result)) {
						return result;
					}
				}
				return result;
			}
			case "or": {
				Object result = Boolean.FALSE;
				for (PygmyExpression child : children) {
					result = child.accept(this);
					if (truthy(result)) {
						return result;
					}
				}
				return result;
			}
			case "not":
				return !truthy(children.get(0).accept(this));
		}
		Object left = children.get(0).accept(this);
		if (children.size() == 1) {
			if (pygmyOp.getOp().equals("-")) {
				return safely(location, () -> Math.negateExact(asInt(location, left)));
			}
			throw new StaticEvaluationException(location, "unsupported operator '" + pygmyOp.getOp() + "'");
		}
		Object right = children.get(1).accept(this);
		switch (pygmyOp.getOp()) {
			case "+":
				if (left instanceof List && right instanceof List) {
					List<Object> result = new ArrayList<>((List<?>) left);
					result.addAll((List<?>) right);
					return Collections.unmodifiableList(result);
				}
				return safely(location, () -> Math.addExact(asInt(location, left), asInt(location, right)));
			case "-":
				return safely(location, () -> Math.subtractExact(asInt(location, left), asInt(location, right)));
			case "*":
				if (left instanceof List || right instanceof List) {
					List<?> list = (List<?>) (left instanceof List ? left : right);
					int times = asInt(location, left instanceof List ? right : left);
					List<Object> result = new ArrayList<>();
					for (int i = 0; i < times; i++) {
						result.addAll(list);
					}
					return Collections.unmodifiableList(result);
				}
				return safely(location, () -> Math.multiplyExact(asInt(location, left), asInt(location, right)));
			case "==":
				return equal(location, left, right);
			case "!=":
				return !equal(location, left, right);
			case "<":
				return asInt(location, left) < asInt(location, right);
			case "<=":
				return asInt(location, left) <= asInt(location, right);
			case ">":
				return asInt(location, left) > asInt(location, right);
			case ">=":
				return asInt(location, left) >= asInt(location, right);
			default:
				throw new StaticEvaluationException(location, "unsupported operator '" + pygmyOp.getOp() + "'");
		}
	}

	private static boolean equal(SourceLocation location, Object left, Object right)
			throws StaticEvaluationException {
		if (isScalar(left) && isScalar(right)) {
			return asInt(location, left) == asInt(location, right);
		}
		return left.equals(right);
	}

	@FunctionalInterface
	private interface IntComputation {
		int compute() throws StaticEvaluationException;
	}

	private static Object safely(SourceLocation location, IntComputation computation)
			throws StaticEvaluationException {
		try {
			return computation.compute();
		} catch (ArithmeticException e) {
			throw new StaticEvaluationException(location, "integer overflow");
		}
	}

	@Override
	public Object visit(PygmyCall pygmyCall) throws StaticEvaluationException {
		Object function = pygmyCall.getFunction().accept(this);
		SourceLocation location = pygmyCall.getLocation();
		List<Object> args = new ArrayList<>();
		for (PygmyExpression arg : pygmyCall.getArguments()) {
			args.add(arg.accept(this));
		}
		if (function == PygmyBuiltinFunction.RANGE) {
			if (args.isEmpty() || args.size() > 3) {
				throw new StaticEvaluationException(location, "range expects 1 to 3 arguments but got " + args.size());
			}
			int start = 0;
			int stop;
			int step = 1;
			if (args.size() == 1) {
				stop = asInt(location, args.get(0));
			} else {
				start = asInt(location, args.get(0));
				stop = asInt(location, args.get(1));
				if (args.size() == 3) {
					step = asInt(location, args.get(2));
				}
			}
			if (step == 0) {
				throw new StaticEvaluationException(location, "range step must not be zero");
			}
			List<Object> result = new ArrayList<>();
			for (long i = start; step > 0 ? i < stop : i > stop; i += step) {
				result.add((int) i);
			}
			return Collections.unmodifiableList(result);
		} else if (function == PygmyBuiltinFunction.LEN) {
			if (args.size() != 1 || !(args.get(0) instanceof List)) {
				throw new StaticEvaluationException(location, "len expects one sequence");
			}
			return ((List<?>) args.get(0)).size();
		} else if (PygmyType.INT.equals(function) || PygmyType.BOOL.equals(function)) {
			if (args.size() > 1) {
				throw new StaticEvaluationException(location, function + " expects at most one argument");
			}
			Object arg = args.isEmpty() ? Integer.valueOf(0) : args.get(0);
			if (PygmyType.BOOL.equals(function)) {
				return truthy(arg);
			}
			return asInt(location, arg);
		}
		throw new StaticEvaluationException(location, describe(function) + " is not callable");
	}

	@Override
	public Object visit(PygmySequence pygmySequence) throws StaticEvaluationException {
		List<Object> result = new ArrayList<>();
		for (PygmyExpression element : pygmySequence.getElements()) {
			result.add(element.accept(this));
		}
		return Collections.unmodifiableList(result);
	}

}
