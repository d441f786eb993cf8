package daddy.model.pygmy;

import daddy.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A function as written. The body keeps global lines, local declarations and statements in source order so
 * that the module builder can check that they come in this order.
 */
public class PygmyFuncDeclaration extends PygmyDeclaration {

	private final PygmyName name;
	private final List<PygmyName> params;
	private final List<PygmyNode> body;

	public PygmyFuncDeclaration(SourceLocation location, PygmyName name, List<PygmyName> params,
	                            List<PygmyNode> body) {
		super(location);
		this.name = name;
		this.params = Collections.unmodifiableList(params);
		this.body = Collections.unmodifiableList(body);
	}

	public PygmyName getName() {
		return name;
	}

	public List<PygmyName> getParams() {
		return params;
	}

	public List<PygmyNode> getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(PygmyDeclarationVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, params, body);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		PygmyFuncDeclaration other = (PygmyFuncDeclaration) obj;
		return Objects.equals(name, other.name) && Objects.equals(params, other.params) &&
				Objects.equals(body, other.body);
	}

}
