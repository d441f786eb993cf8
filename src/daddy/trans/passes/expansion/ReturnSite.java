package daddy.trans.passes.expansion;

import daddy.model.pygmy.PygmyLookup;

/**
 * Where the value returned by an inlined function goes.
 */
public final class ReturnSite {

	private static final ReturnSite ENTRY = new ReturnSite(null, null, true);
	private static final ReturnSite DISCARD = new ReturnSite(null, null, false);

	private final PygmyLookup target;
	private final String op;
	private final boolean entry;

	private ReturnSite(PygmyLookup target, String op, boolean entry) {
		this.target = target;
		this.op = op;
		this.entry = entry;
	}

	public static ReturnSite entry() {
		return ENTRY;
	}

	public static ReturnSite discard() {
		return DISCARD;
	}

	public static ReturnSite assign(PygmyLookup target, String op) {
		return new ReturnSite(target, op, false);
	}

	public PygmyLookup getTarget() {
		return target;
	}

	public String getOp() {
		return op;
	}

	public boolean isEntry() {
		return entry;
	}

	public boolean needsValue() {
		return target != null;
	}

}
