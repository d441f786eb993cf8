package daddy.trans;

import daddy.DaddyException;

/**
 * Exception raised when compiling a pygmy module into homomorphisms fails
 *
 */
public class DaddyTransException extends DaddyException {

	private static final long serialVersionUID = -3815523064127719921L;
	private static final String prefix = "Translation Error";

	public DaddyTransException(String msg) {
		super(prefix, msg);
	}

}
