package daddy.trans.passes.scope;

import daddy.errors.IssueContext;
import daddy.model.pygmy.*;
import daddy.trans.UnsupportedFeatureIssue;
import daddy.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads the top-level declarations in order. Static bindings, imports, variables and structs are resolved
 * immediately against what was declared before them; function bodies are resolved once every declaration has
 * been read, each against the compile-time names that were visible where the function was declared.
 */
public class PygmyModuleBuilder extends PygmyDeclarationVisitor<Void, RuntimeException> {

	private final IssueContext ctx;
	private final Map<String, Object> statics = PygmyBuiltinModule.initialEnvironment();
	private final Map<String, SourceLocation> declared = new HashMap<>();
	private final Map<String, Object> constants = new LinkedHashMap<>();
	private final Map<String, PygmyVar> vars = new LinkedHashMap<>();
	private final Map<String, PygmyStruct> structs = new LinkedHashMap<>();
	private final Map<String, PygmyFuncDeclaration> funcDeclarations = new LinkedHashMap<>();
	private final Map<String, Map<String, Object>> funcStatics = new HashMap<>();
	private final Set<String> renamedLocals = new HashSet<>();

	public PygmyModuleBuilder(IssueContext ctx) {
		this.ctx = ctx;
		declared.put(PygmyBuiltinModule.NAME, SourceLocation.unknown());
	}

	private boolean declare(String name, SourceLocation location) {
		if (declared.containsKey(name)) {
			ctx.error(new ScopeConflictIssue(name, location, declared.get(name)));
			return false;
		}
		declared.put(name, location);
		return true;
	}

	private StaticEvaluator evaluator() {
		return new StaticEvaluator(statics);
	}

	@Override
	public Void visit(PygmyStaticBinding pygmyStaticBinding) throws RuntimeException {
		String name = pygmyStaticBinding.getName().getId();
		if (!declare(name, pygmyStaticBinding.getName().getLocation())) {
			return null;
		}
		try {
			Object value = evaluator().evaluate(pygmyStaticBinding.getValue());
			statics.put(name, value);
			if (StaticEvaluator.isData(value)) {
				constants.put(name, value);
			}
		} catch (StaticEvaluationException e) {
			ctx.error(e.toIssue());
		}
		return null;
	}

	@Override
	public Void visit(PygmyImport pygmyImport) throws RuntimeException {
		if (!pygmyImport.getModule().equals(PygmyBuiltinModule.NAME)) {
			ctx.error(new UnsupportedFeatureIssue(pygmyImport.getLocation(),
					"import of module '" + pygmyImport.getModule() + "'"));
			return null;
		}
		if (!pygmyImport.isFromImport()) {
			String alias = pygmyImport.getAlias();
			if (alias != null && declare(alias, pygmyImport.getLocation())) {
				statics.put(alias, PygmyBuiltinModule.INSTANCE);
			}
			return null;
		}
		for (Map.Entry<String, String> name : pygmyImport.getNames().entrySet()) {
			Object export = PygmyBuiltinModule.INSTANCE.getExports().get(name.getValue());
			if (export == null) {
				ctx.error(new StaticEvaluationIssue(pygmyImport.getLocation(),
						"module '" + PygmyBuiltinModule.NAME + "' has no member '" + name.getValue() + "'"));
			} else if (declare(name.getKey(), pygmyImport.getLocation())) {
				statics.put(name.getKey(), export);
			}
		}
		return null;
	}

	/**
	 * @return the resolved variable, or null if it was reported as invalid
	 */
	PygmyVar resolveVar(PygmyVarDeclaration declaration, String name, boolean allowStruct, StaticEvaluator evaluator) {
		try {
			Object type = evaluator.evaluate(declaration.getType());
			if (!(type instanceof PygmyType)) {
				ctx.error(new StaticEvaluationIssue(declaration.getType().getLocation(),
						StaticEvaluator.describe(type) + " is not a type"));
				return null;
			}
			PygmyType resolvedType = (PygmyType) type;
			if (resolvedType.isStruct() && !allowStruct) {
				ctx.error(new StaticEvaluationIssue(declaration.getType().getLocation(),
						"local variables must have type int or bool"));
				return null;
			}
			Integer size = null;
			if (declaration.getSize() != null) {
				size = StaticEvaluator.asInt(declaration.getSize().getLocation(),
						evaluator.evaluate(declaration.getSize()));
				if (size < 0) {
					ctx.error(new StaticEvaluationIssue(declaration.getSize().getLocation(),
							"array size must not be negative"));
					return null;
				}
			}
			Object init = null;
			if (declaration.getInit() != null) {
				SourceLocation initLocation = declaration.getInit().getLocation();
				if (resolvedType.isStruct()) {
					ctx.error(new StaticEvaluationIssue(initLocation,
							"variables of struct type cannot have an initial value"));
					return null;
				}
				init = evaluator.evaluate(declaration.getInit());
				if (size == null && !StaticEvaluator.isScalar(init)) {
					ctx.error(new StaticEvaluationIssue(initLocation, "expected an integer or a boolean"));
					return null;
				}
				if (size != null) {
					if (StaticEvaluator.isScalar(init)) {
						init = Collections.nCopies(size, init);
					} else if (!(init instanceof List) || ((List<?>) init).size() != size ||
							!((List<?>) init).stream().allMatch(StaticEvaluator::isScalar)) {
						ctx.error(new StaticEvaluationIssue(initLocation,
								"expected a scalar or a sequence of " + size + " scalars"));
						return null;
					}
				}
			}
			return new PygmyVar(declaration.getLocation(), name, resolvedType, size, init);
		} catch (StaticEvaluationException e) {
			ctx.error(e.toIssue());
			return null;
		}
	}

	@Override
	public Void visit(PygmyVarDeclaration pygmyVarDeclaration) throws RuntimeException {
		String name = pygmyVarDeclaration.getName().getId();
		PygmyVar var = resolveVar(pygmyVarDeclaration, name, true, evaluator());
		if (var != null && declare(name, pygmyVarDeclaration.getName().getLocation())) {
			statics.remove(name);
			vars.put(name, var);
		}
		return null;
	}

	@Override
	public Void visit(PygmyStructDeclaration pygmyStructDeclaration) throws RuntimeException {
		String name = pygmyStructDeclaration.getName().getId();
		if (!declare(name, pygmyStructDeclaration.getName().getLocation())) {
			return null;
		}
		List<String> parents = new ArrayList<>();
		Map<String, PygmyVar> fields = new LinkedHashMap<>();
		for (PygmyExpression parent : pygmyStructDeclaration.getParents()) {
			Object type;
			try {
				type = evaluator().evaluate(parent);
			} catch (StaticEvaluationException e) {
				ctx.error(e.toIssue());
				continue;
			}
			if (!(type instanceof PygmyType) || !structs.containsKey(((PygmyType) type).getName())) {
				ctx.error(new StaticEvaluationIssue(parent.getLocation(),
						StaticEvaluator.describe(type) + " is not a struct"));
				continue;
			}
			PygmyStruct parentStruct = structs.get(((PygmyType) type).getName());
			parents.add(parentStruct.getName());
			for (PygmyVar field : parentStruct.getFields()) {
				if (fields.containsKey(field.getName())) {
					ctx.error(new ScopeConflictIssue(field.getName(), parent.getLocation(),
							fields.get(field.getName()).getLocation()));
				} else {
					fields.put(field.getName(), field);
				}
			}
		}
		for (PygmyVarDeclaration fieldDeclaration : pygmyStructDeclaration.getFields()) {
			String fieldName = fieldDeclaration.getName().getId();
			PygmyVar field = resolveVar(fieldDeclaration, fieldName, true, evaluator());
			if (field == null) {
				continue;
			}
			if (fields.containsKey(fieldName)) {
				ctx.error(new ScopeConflictIssue(fieldName, fieldDeclaration.getName().getLocation(),
						fields.get(fieldName).getLocation()));
			} else {
				fields.put(fieldName, field);
			}
		}
		structs.put(name, new PygmyStruct(pygmyStructDeclaration.getLocation(), name, parents,
				new ArrayList<>(fields.values())));
		statics.put(name, PygmyType.struct(name));
		return null;
	}

	@Override
	public Void visit(PygmyFuncDeclaration pygmyFuncDeclaration) throws RuntimeException {
		String name = pygmyFuncDeclaration.getName().getId();
		if (!declare(name, pygmyFuncDeclaration.getName().getLocation())) {
			return null;
		}
		statics.remove(name);
		funcDeclarations.put(name, pygmyFuncDeclaration);
		funcStatics.put(name, new HashMap<>(statics));
		return null;
	}

	private PygmyFunc resolveFunc(PygmyFuncDeclaration declaration) {
		String name = declaration.getName().getId();
		Map<String, Object> visibleStatics = funcStatics.get(name);
		FunctionScope scope = new FunctionScope(name, visibleStatics, vars.keySet(), funcDeclarations.keySet());
		Map<String, SourceLocation> names = new HashMap<>();
		List<String> params = new ArrayList<>();
		for (PygmyName param : declaration.getParams()) {
			if (names.containsKey(param.getId())) {
				ctx.error(new ScopeConflictIssue(param.getId(), param.getLocation(), names.get(param.getId())));
				continue;
			}
			names.put(param.getId(), param.getLocation());
			params.add(param.getId());
			scope.addParam(param.getId());
		}
		List<String> globals = new ArrayList<>();
		List<PygmyVar> locals = new ArrayList<>();
		List<PygmyStatement> statements = new ArrayList<>();
		StaticEvaluator evaluator = new StaticEvaluator(visibleStatics);
		for (PygmyNode item : declaration.getBody()) {
			if (item instanceof PygmyGlobal) {
				if (!locals.isEmpty() || !statements.isEmpty()) {
					ctx.error(new DeclarationOrderIssue(item, "local declarations and statements"));
					continue;
				}
				for (PygmyName global : ((PygmyGlobal) item).getNames()) {
					if (names.containsKey(global.getId())) {
						ctx.error(new ScopeConflictIssue(global.getId(), global.getLocation(),
								names.get(global.getId())));
					} else if (!scope.isModuleVar(global.getId())) {
						ctx.error(new UndeclaredNameIssue(global));
					} else {
						names.put(global.getId(), global.getLocation());
						globals.add(global.getId());
						scope.addGlobal(global.getId());
					}
				}
			} else if (item instanceof PygmyVarDeclaration) {
				PygmyVarDeclaration local = (PygmyVarDeclaration) item;
				String localName = local.getName().getId();
				if (!statements.isEmpty()) {
					ctx.error(new DeclarationOrderIssue(item, "statements"));
					continue;
				}
				if (names.containsKey(localName)) {
					ctx.error(new ScopeConflictIssue(localName, local.getName().getLocation(), names.get(localName)));
					continue;
				}
				String renamed = name + "_" + localName;
				if (declared.containsKey(renamed) || !renamedLocals.add(renamed)) {
					ctx.error(new ScopeConflictIssue(renamed, local.getName().getLocation(),
							declared.getOrDefault(renamed, SourceLocation.unknown())));
					continue;
				}
				PygmyVar var = resolveVar(local, renamed, false, evaluator);
				if (var != null) {
					names.put(localName, local.getName().getLocation());
					scope.addLocal(localName);
					locals.add(var);
				}
			} else {
				statements.add((PygmyStatement) item);
			}
		}
		List<PygmyStatement> body = new PygmyStatementScopingVisitor(ctx, scope).scopeBlock(statements);
		return new PygmyFunc(declaration.getLocation(), name, params, globals, locals, body);
	}

	public PygmyModule build(SourceLocation location) {
		Map<String, PygmyFunc> funcs = new LinkedHashMap<>();
		for (PygmyFuncDeclaration declaration : funcDeclarations.values()) {
			funcs.put(declaration.getName().getId(), resolveFunc(declaration));
		}
		return new PygmyModule(location, constants, vars, structs, funcs);
	}

}
