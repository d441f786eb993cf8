package daddy.trans.passes.expansion;

import daddy.errors.IssueContext;
import daddy.model.pygmy.*;
import daddy.trans.UnsupportedFeatureIssue;
import daddy.trans.passes.scope.ScopeConflictIssue;
import daddy.util.SourceLocation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flattens one entry function. Every activation (the entry itself and each inlined call) gets its locals
 * renamed with the entry's name as prefix and initialised at the start of the activation; parameters bound to
 * anything but a constant are copied into temporaries named {@code <entry>_<function>_<param>}.
 */
public class PygmyFunctionInliner {

	private final PygmyModule module;
	private final String entry;
	private final Map<String, Object> env;
	private final Map<String, PygmyVar> locals = new LinkedHashMap<>();
	private final Deque<String> callStack = new ArrayDeque<>();

	public PygmyFunctionInliner(PygmyModule module, String entry, Map<String, Object> env) {
		this.module = module;
		this.entry = entry;
		this.env = env;
	}

	Map<String, Object> getEnvironment() {
		return env;
	}

	public Map<String, PygmyVar> getLocals() {
		return locals;
	}

	public List<PygmyStatement> inlineEntry(IssueContext ctx, PygmyFunc func) {
		if (!func.getParams().isEmpty()) {
			ctx.error(new UnsupportedFeatureIssue(func.getLocation(), "parameters on entry function '" +
					func.getName() + "'"));
			return Collections.emptyList();
		}
		return activate(ctx, func, new HashMap<>(), new ArrayList<>(), ReturnSite.entry());
	}

	List<PygmyStatement> inlineCall(IssueContext ctx, PygmyCall call, ReturnSite site) {
		String name = ((PygmyName) call.getFunction()).getId();
		PygmyFunc func = module.getFuncs().get(name);
		if (callStack.contains(name)) {
			ctx.error(new RecursiveCallIssue(call, name));
			return Collections.emptyList();
		}
		if (func.getParams().size() != call.getArguments().size()) {
			ctx.error(new CallArgumentCountMismatchIssue(call, func));
			return Collections.emptyList();
		}
		IssueContext nested = ctx.withContext(new InliningCall(call, name));
		Map<String, PygmyExpression> bindings = new HashMap<>();
		List<PygmyStatement> prologue = new ArrayList<>();
		for (int i = 0; i < func.getParams().size(); i++) {
			String param = func.getParams().get(i);
			PygmyExpression arg = call.getArguments().get(i);
			if (arg instanceof PygmyConst || arg instanceof PygmyName && env.containsKey(((PygmyName) arg).getId())) {
				bindings.put(param, arg);
				continue;
			}
			if (arg instanceof PygmyName) {
				PygmyVar var = module.getVars().get(((PygmyName) arg).getId());
				if (var != null && (var.isArray() || var.getType().isStruct())) {
					nested.error(new UnsupportedFeatureIssue(arg.getLocation(),
							"passing the whole of '" + var.getName() + "' as an argument"));
					continue;
				}
			}
			String temporary = entry + "_" + name + "_" + param;
			declareLocal(nested, new PygmyVar(arg.getLocation(), temporary, PygmyType.INT, null, null));
			PygmyName tempName = new PygmyName(arg.getLocation(), temporary);
			prologue.add(new PygmyAssign(arg.getLocation(), tempName, arg, null));
			bindings.put(param, tempName);
		}
		return activate(nested, func, bindings, prologue, site);
	}

	private void declareLocal(IssueContext ctx, PygmyVar var) {
		String name = var.getName();
		SourceLocation previous = null;
		if (module.getVars().containsKey(name)) {
			previous = module.getVars().get(name).getLocation();
		} else if (module.getStructs().containsKey(name)) {
			previous = module.getStructs().get(name).getLocation();
		} else if (module.getFuncs().containsKey(name)) {
			previous = module.getFuncs().get(name).getLocation();
		} else if (module.getConstants().containsKey(name)) {
			previous = SourceLocation.unknown();
		}
		if (previous != null) {
			ctx.error(new ScopeConflictIssue(name, var.getLocation(), previous));
			return;
		}
		locals.putIfAbsent(name, var);
	}

	private List<PygmyStatement> initialise(PygmyVar var) {
		SourceLocation location = var.getLocation();
		PygmyName name = new PygmyName(location, var.getName());
		boolean isBool = var.getType().equals(PygmyType.BOOL);
		if (!var.isArray()) {
			PygmyExpression value = var.getInit() == null ? zero(location, isBool) : constant(location, var.getInit());
			return Collections.singletonList(new PygmyAssign(location, name, value, null));
		}
		List<PygmyStatement> result = new ArrayList<>();
		for (int i = 0; i < var.getSize(); i++) {
			PygmyExpression value = var.getInit() == null ? zero(location, isBool) :
					constant(location, ((List<?>) var.getInit()).get(i));
			result.add(new PygmyAssign(location, new PygmyItem(location, name, new PygmyConst(location, i)), value,
					null));
		}
		return result;
	}

	private static PygmyExpression zero(SourceLocation location, boolean isBool) {
		return isBool ? new PygmyConst(location, false) : new PygmyConst(location, 0);
	}

	private static PygmyExpression constant(SourceLocation location, Object value) {
		return value instanceof Boolean ? new PygmyConst(location, (Boolean) value) :
				new PygmyConst(location, (Integer) value);
	}

	private List<PygmyStatement> activate(IssueContext ctx, PygmyFunc func, Map<String, PygmyExpression> bindings,
	                                      List<PygmyStatement> prologue, ReturnSite site) {
		callStack.push(func.getName());
		List<PygmyStatement> result = new ArrayList<>(prologue);
		for (PygmyVar local : func.getLocals()) {
			PygmyVar renamed = local.withName(entry + "_" + local.getName());
			declareLocal(ctx, renamed);
			bindings.put(local.getName(), new PygmyName(local.getLocation(), renamed.getName()));
			result.addAll(initialise(renamed));
		}
		List<PygmyStatement> body = new PygmyStatementInliningVisitor(ctx, this, bindings).expandBlock(func.getBody());
		body = PygmyReturnNormalizer.normalize(body);
		if (site.needsValue() && !PygmyReturnNormalizer.alwaysReturns(body)) {
			ctx.error(new MissingReturnIssue(func));
		}
		result.addAll(rewriteReturns(ctx, func, body, site));
		callStack.pop();
		return result;
	}

	private List<PygmyStatement> rewriteReturns(IssueContext ctx, PygmyFunc func, List<PygmyStatement> block,
	                                            ReturnSite site) {
		List<PygmyStatement> result = new ArrayList<>();
		for (PygmyStatement statement : block) {
			if (statement instanceof PygmyReturn) {
				PygmyReturn pygmyReturn = (PygmyReturn) statement;
				if (site.needsValue()) {
					if (pygmyReturn.hasValue()) {
						result.add(new PygmyAssign(pygmyReturn.getLocation(), site.getTarget(), pygmyReturn.getValue(),
								site.getOp()));
					} else {
						ctx.error(new ReturnValueMismatchIssue(pygmyReturn, func.getName(), true));
					}
				} else if (site.isEntry() && pygmyReturn.hasValue()) {
					ctx.error(new ReturnValueMismatchIssue(pygmyReturn, func.getName(), false));
				}
			} else if (statement instanceof PygmyIf) {
				PygmyIf pygmyIf = (PygmyIf) statement;
				List<PygmyStatement> then = rewriteReturns(ctx, func, pygmyIf.getThen(), site);
				List<PygmyStatement> orElse = rewriteReturns(ctx, func, pygmyIf.getOrElse(), site);
				if (!then.isEmpty() || !orElse.isEmpty()) {
					result.add(new PygmyIf(pygmyIf.getLocation(), pygmyIf.getCondition(), then, orElse));
				}
			} else {
				result.add(statement);
			}
		}
		return result;
	}

}
