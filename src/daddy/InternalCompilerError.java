package daddy;

public class InternalCompilerError extends RuntimeException {
	public InternalCompilerError() {
		super("internal compiler error");
	}

	public InternalCompilerError(String msg) {
		super("internal compiler error: " + msg);
	}

	public InternalCompilerError(Exception e) {
		super("internal compiler error", e);
	}
}
