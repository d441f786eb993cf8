package daddy.model.pygmy;

import daddy.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A resolved function: every name in the body is a parameter, one of the declared globals, or one of the
 * (already renamed) locals.
 */
public class PygmyFunc extends PygmyNode {

	private final String name;
	private final List<String> params;
	private final List<String> globals;
	private final List<PygmyVar> locals;
	private final List<PygmyStatement> body;

	public PygmyFunc(SourceLocation location, String name, List<String> params, List<String> globals,
	                 List<PygmyVar> locals, List<PygmyStatement> body) {
		super(location);
		this.name = name;
		this.params = Collections.unmodifiableList(params);
		this.globals = Collections.unmodifiableList(globals);
		this.locals = Collections.unmodifiableList(locals);
		this.body = Collections.unmodifiableList(body);
	}

	public String getName() {
		return name;
	}

	public List<String> getParams() {
		return params;
	}

	public List<String> getGlobals() {
		return globals;
	}

	public List<PygmyVar> getLocals() {
		return locals;
	}

	public List<PygmyStatement> getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(PygmyNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, params, globals, locals, body);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		PygmyFunc other = (PygmyFunc) obj;
		return Objects.equals(name, other.name) && Objects.equals(params, other.params) &&
				Objects.equals(globals, other.globals) && Objects.equals(locals, other.locals) &&
				Objects.equals(body, other.body);
	}

}
