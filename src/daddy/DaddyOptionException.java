package daddy;

public class DaddyOptionException extends DaddyException {

	public DaddyOptionException(String msg) {
		super("Option Error", msg);
	}

}
