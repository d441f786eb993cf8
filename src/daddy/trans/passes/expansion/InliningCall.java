package daddy.trans.passes.expansion;

import daddy.errors.Context;
import daddy.errors.ContextVisitor;
import daddy.model.pygmy.PygmyCall;

public class InliningCall extends Context {

	private final PygmyCall call;
	private final String function;

	public InliningCall(PygmyCall call, String function) {
		this.call = call;
		this.function = function;
	}

	public PygmyCall getCall() {
		return call;
	}

	public String getFunction() {
		return function;
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> ctx) throws E {
		return ctx.visit(this);
	}

}
