package daddy.model.pygmy;

import daddy.util.SourceLocation;

import java.util.Objects;

public class PygmyBareCall extends PygmyStatement {

	private final PygmyCall call;

	public PygmyBareCall(SourceLocation location, PygmyCall call) {
		super(location);
		this.call = call;
	}

	public PygmyCall getCall() {
		return call;
	}

	@Override
	public <T, E extends Throwable> T accept(PygmyStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(call);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		PygmyBareCall other = (PygmyBareCall) obj;
		return Objects.equals(call, other.call);
	}

}
