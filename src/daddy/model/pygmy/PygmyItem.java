package daddy.model.pygmy;

import daddy.util.SourceLocation;

import java.util.Objects;

/**
 * Index access, value[item]
 */
public class PygmyItem extends PygmyLookup {

	private final PygmyLookup value;
	private final PygmyExpression item;

	public PygmyItem(SourceLocation location, PygmyLookup value, PygmyExpression item) {
		super(location);
		this.value = value;
		this.item = item;
	}

	public PygmyLookup getValue() {
		return value;
	}

	public PygmyExpression getItem() {
		return item;
	}

	@Override
	public PygmyName getRoot() {
		return value.getRoot();
	}

	@Override
	public PygmyLookup withRoot(PygmyName root) {
		return new PygmyItem(getLocation(), value.withRoot(root), item);
	}

	@Override
	public <T, E extends Throwable> T accept(PygmyExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value, item);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		PygmyItem other = (PygmyItem) obj;
		return Objects.equals(value, other.value) && Objects.equals(item, other.item);
	}

}
