package daddy.model.ddd;

/**
 * What homomorphisms need from a decision diagram engine.
 *
 * A diagram is either the null diagram (no path at all), the one diagram (the empty path, which accepts), or an
 * edge followed by a remainder diagram.
 */
public interface Diagram {

	boolean isNull();

	boolean isOne();

	/**
	 * @return the first edge; only defined when the diagram is neither null nor one
	 */
	Edge getHead();

	/**
	 * @return the remainder after the first edge; only defined when the diagram is neither null nor one
	 */
	Diagram getTail();

	/**
	 * @return the diagram made of the given edge followed by this one; prepending to null yields null
	 */
	Diagram prepend(Edge edge);

	Diagram nullDiagram();

}
