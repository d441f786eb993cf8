package daddy.errors;

import daddy.trans.passes.expansion.InliningCall;

public abstract class ContextVisitor<T, E extends Throwable> {

	public abstract T visit(InliningCall inliningCall) throws E;

}
