package daddy.model.pygmy;

import daddy.util.SourceLocation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shorthands for building syntax trees with unknown locations.
 */
public class PygmyBuilder {
	private PygmyBuilder() {}

	public static PygmyConst num(int value) {
		return new PygmyConst(SourceLocation.unknown(), value);
	}

	public static PygmyConst bool(boolean value) {
		return new PygmyConst(SourceLocation.unknown(), value);
	}

	public static PygmyName name(String id) {
		return new PygmyName(SourceLocation.unknown(), id);
	}

	public static PygmyAttr attr(PygmyLookup value, String attr) {
		return new PygmyAttr(SourceLocation.unknown(), value, attr);
	}

	public static PygmyItem item(PygmyLookup value, PygmyExpression item) {
		return new PygmyItem(SourceLocation.unknown(), value, item);
	}

	public static PygmyOp op(String op, PygmyExpression... children) {
		return new PygmyOp(SourceLocation.unknown(), op, Arrays.asList(children));
	}

	public static PygmyCall call(String function, PygmyExpression... args) {
		return new PygmyCall(SourceLocation.unknown(), name(function), Arrays.asList(args));
	}

	public static PygmySequence seq(PygmyExpression... elements) {
		return new PygmySequence(SourceLocation.unknown(), Arrays.asList(elements));
	}

	public static PygmyPass pass() {
		return new PygmyPass(SourceLocation.unknown());
	}

	public static PygmyAssign assign(PygmyLookup target, PygmyExpression value) {
		return new PygmyAssign(SourceLocation.unknown(), target, value, null);
	}

	public static PygmyAssign augAssign(PygmyLookup target, String op, PygmyExpression value) {
		return new PygmyAssign(SourceLocation.unknown(), target, value, op);
	}

	public static PygmyIf ifS(PygmyExpression condition, List<PygmyStatement> then, List<PygmyStatement> orElse) {
		return new PygmyIf(SourceLocation.unknown(), condition, then, orElse);
	}

	public static PygmyFor forS(String variable, PygmyExpression iterable, PygmyStatement... body) {
		return new PygmyFor(SourceLocation.unknown(), name(variable), iterable, Arrays.asList(body));
	}

	public static PygmyReturn returnS() {
		return new PygmyReturn(SourceLocation.unknown(), null);
	}

	public static PygmyReturn returnS(PygmyExpression value) {
		return new PygmyReturn(SourceLocation.unknown(), value);
	}

	public static PygmyBareCall bareCall(String function, PygmyExpression... args) {
		return new PygmyBareCall(SourceLocation.unknown(), call(function, args));
	}

	public static List<PygmyStatement> block(PygmyStatement... statements) {
		return Arrays.asList(statements);
	}

	public static PygmyVar var(String name, PygmyType type, Integer size, Object init) {
		return new PygmyVar(SourceLocation.unknown(), name, type, size, init);
	}

	public static PygmyVar intVar(String name, int init) {
		return var(name, PygmyType.INT, null, init);
	}

	public static PygmyStruct struct(String name, PygmyVar... fields) {
		return new PygmyStruct(SourceLocation.unknown(), name, Collections.emptyList(), Arrays.asList(fields));
	}

	public static PygmyFunc func(String name, List<String> params, List<String> globals, List<PygmyVar> locals,
	                             PygmyStatement... body) {
		return new PygmyFunc(SourceLocation.unknown(), name, params, globals, locals, Arrays.asList(body));
	}

	public static PygmyModule module(List<PygmyVar> vars, List<PygmyStruct> structs, List<PygmyFunc> funcs) {
		Map<String, PygmyVar> varMap = new LinkedHashMap<>();
		for (PygmyVar var : vars) {
			varMap.put(var.getName(), var);
		}
		Map<String, PygmyStruct> structMap = new LinkedHashMap<>();
		for (PygmyStruct struct : structs) {
			structMap.put(struct.getName(), struct);
		}
		Map<String, PygmyFunc> funcMap = new LinkedHashMap<>();
		for (PygmyFunc func : funcs) {
			funcMap.put(func.getName(), func);
		}
		return new PygmyModule(SourceLocation.unknown(), Collections.emptyMap(), varMap, structMap, funcMap);
	}

	public static List<Object> values(Object... values) {
		return new ArrayList<>(Arrays.asList(values));
	}
}
