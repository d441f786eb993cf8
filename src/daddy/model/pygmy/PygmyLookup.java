package daddy.model.pygmy;

import daddy.util.SourceLocation;

/**
 * Anything that may appear on the left-hand side of an assignment: a name, possibly followed by field accesses
 * and indexes.
 */
public abstract class PygmyLookup extends PygmyExpression {

	public PygmyLookup(SourceLocation location) {
		super(location);
	}

	/**
	 * @return the name this lookup starts from
	 */
	public abstract PygmyName getRoot();

	/**
	 * @return the same lookup, started from another name
	 */
	public abstract PygmyLookup withRoot(PygmyName root);

}
