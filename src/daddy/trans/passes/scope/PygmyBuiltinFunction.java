package daddy.trans.passes.scope;

public enum PygmyBuiltinFunction {
	RANGE("range"),
	LEN("len");

	private final String name;

	PygmyBuiltinFunction(String name) {
		this.name = name;
	}

	public String getName() {
		return name;
	}
}
