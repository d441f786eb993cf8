package daddy.model.pygmy;

import daddy.Unreachable;
import daddy.formatters.IndentingWriter;
import daddy.formatters.PygmyNodeFormattingVisitor;
import daddy.util.SourceLocatable;
import daddy.util.SourceLocation;

import java.io.IOException;
import java.io.StringWriter;

/**
 * Base of the pygmy syntax tree. Nodes are immutable and every node carries the location it was read from;
 * synthesized nodes inherit the location of the node they replace.
 */
public abstract class PygmyNode extends SourceLocatable {

	private final SourceLocation location;

	public PygmyNode(SourceLocation location) {
		this.location = location;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);

	public abstract <T, E extends Throwable> T accept(PygmyNodeVisitor<T, E> v) throws E;

	@Override
	public String toString() {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		try {
			accept(new PygmyNodeFormattingVisitor(out));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return w.toString();
	}

}
