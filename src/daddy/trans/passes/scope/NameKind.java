package daddy.trans.passes.scope;

public enum NameKind {
	LOOP_VARIABLE,
	PARAMETER,
	LOCAL,
	GLOBAL,
	FUNCTION,
	STATIC,
	// a module variable that the function did not declare global
	MODULE_VARIABLE,
	UNDECLARED,
}
