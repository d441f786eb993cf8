package daddy.trans.passes.expansion;

import daddy.errors.IssueContext;
import daddy.model.pygmy.*;
import daddy.trans.passes.scope.PygmyBuiltinModule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class InliningPass {
	private InliningPass() {}

	private static void collectStructs(PygmyModule module, String name, Map<String, PygmyStruct> structs) {
		PygmyStruct struct = module.getStructs().get(name);
		if (struct == null || structs.containsKey(name)) {
			return;
		}
		for (String parent : struct.getParents()) {
			collectStructs(module, parent, structs);
		}
		for (PygmyVar field : struct.getFields()) {
			if (field.getType().isStruct()) {
				collectStructs(module, field.getType().getName(), structs);
			}
		}
		structs.put(name, struct);
	}

	/**
	 * @return the functions without parameters that return no value, which are the entry points when none are
	 * given
	 */
	public static List<String> defaultEntries(PygmyModule module) {
		List<String> entries = new ArrayList<>();
		for (PygmyFunc func : module.getFuncs().values()) {
			if (func.getParams().isEmpty() &&
					func.getBody().stream().noneMatch(PygmyReturnNormalizer::returnsValue)) {
				entries.add(func.getName());
			}
		}
		return entries;
	}

	/**
	 * Restricts the module to the given entry functions, each flattened into a body free of calls and loops.
	 * Only the variables, structs and constants these bodies refer to are kept.
	 */
	public static PygmyModule perform(IssueContext ctx, PygmyModule module, List<String> entries) {
		Map<String, Object> env = new HashMap<>(module.getConstants());
		env.put(PygmyBuiltinModule.NAME, PygmyBuiltinModule.INSTANCE);
		Map<String, PygmyFunc> funcs = new LinkedHashMap<>();
		Set<String> referenced = new LinkedHashSet<>();
		for (String entry : entries) {
			PygmyFunc func = module.getFuncs().get(entry);
			if (func == null) {
				ctx.error(new UnknownEntryFunctionIssue(entry));
				continue;
			}
			PygmyFunctionInliner inliner = new PygmyFunctionInliner(module, entry, env);
			List<PygmyStatement> body = inliner.inlineEntry(ctx, func);
			Set<String> names = PygmyNameCollectionVisitor.collect(body);
			List<String> globals = new ArrayList<>();
			for (String name : names) {
				if (module.getVars().containsKey(name)) {
					globals.add(name);
				}
			}
			referenced.addAll(names);
			funcs.put(entry, new PygmyFunc(func.getLocation(), entry, Collections.emptyList(), globals,
					new ArrayList<>(inliner.getLocals().values()), body));
		}

		Map<String, Object> constants = new LinkedHashMap<>();
		for (Map.Entry<String, Object> constant : module.getConstants().entrySet()) {
			if (referenced.contains(constant.getKey())) {
				constants.put(constant.getKey(), constant.getValue());
			}
		}
		Map<String, PygmyVar> vars = new LinkedHashMap<>();
		Map<String, PygmyStruct> structs = new LinkedHashMap<>();
		for (PygmyVar var : module.getVars().values()) {
			if (referenced.contains(var.getName())) {
				vars.put(var.getName(), var);
				if (var.getType().isStruct()) {
					collectStructs(module, var.getType().getName(), structs);
				}
			}
		}
		return new PygmyModule(module.getLocation(), constants, vars, structs, funcs);
	}
}
