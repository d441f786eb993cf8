package daddy.model.pygmy;

import daddy.util.SourceLocation;

public class PygmyPass extends PygmyStatement {

	public PygmyPass(SourceLocation location) {
		super(location);
	}

	@Override
	public <T, E extends Throwable> T accept(PygmyStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return 23;
	}

	@Override
	public boolean equals(Object obj) {
		return obj != null && getClass() == obj.getClass();
	}

}
