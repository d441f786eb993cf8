package daddy.model.ddd;

import daddy.InternalCompilerError;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A diagram holding at most one path, stored as an immutable list of edges. Good enough to check homomorphisms
 * path by path; a shared-DAG engine would implement {@link Diagram} the same way for every path.
 */
public final class PathDiagram implements Diagram {

	private static final PathDiagram NULL = new PathDiagram(null, 0);
	private static final PathDiagram ONE = new PathDiagram(Collections.emptyList(), 0);

	// null for the null diagram
	private final List<Edge> edges;
	private final int start;

	private PathDiagram(List<Edge> edges, int start) {
		this.edges = edges;
		this.start = start;
	}

	public static PathDiagram nullPath() {
		return NULL;
	}

	public static PathDiagram one() {
		return ONE;
	}

	public static PathDiagram of(List<Edge> edges) {
		return new PathDiagram(Collections.unmodifiableList(new ArrayList<>(edges)), 0);
	}

	public static PathDiagram of(Edge... edges) {
		return of(Arrays.asList(edges));
	}

	public static PathDiagram from(Diagram diagram) {
		if (diagram instanceof PathDiagram) {
			return (PathDiagram) diagram;
		}
		if (diagram.isNull()) {
			return NULL;
		}
		List<Edge> edges = new ArrayList<>();
		Diagram current = diagram;
		while (!current.isOne()) {
			edges.add(current.getHead());
			current = current.getTail();
		}
		return of(edges);
	}

	/**
	 * @return the edges of the path, empty for both the one and the null diagram
	 */
	public List<Edge> getEdges() {
		if (edges == null) {
			return Collections.emptyList();
		}
		return edges.subList(start, edges.size());
	}

	/**
	 * @return the value of the variable on this path
	 */
	public int get(String variable) {
		for (Edge edge : getEdges()) {
			if (edge.getVariable().equals(variable)) {
				return edge.getValue();
			}
		}
		throw new IllegalArgumentException("no variable '" + variable + "' on path " + this);
	}

	@Override
	public boolean isNull() {
		return edges == null;
	}

	@Override
	public boolean isOne() {
		return edges != null && start == edges.size();
	}

	@Override
	public Edge getHead() {
		if (isNull() || isOne()) {
			throw new InternalCompilerError("head of a terminal diagram");
		}
		return edges.get(start);
	}

	@Override
	public Diagram getTail() {
		if (isNull() || isOne()) {
			throw new InternalCompilerError("tail of a terminal diagram");
		}
		return new PathDiagram(edges, start + 1);
	}

	@Override
	public Diagram prepend(Edge edge) {
		if (isNull()) {
			return this;
		}
		List<Edge> result = new ArrayList<>(getEdges().size() + 1);
		result.add(edge);
		result.addAll(getEdges());
		return new PathDiagram(Collections.unmodifiableList(result), 0);
	}

	@Override
	public Diagram nullDiagram() {
		return NULL;
	}

	@Override
	public int hashCode() {
		return isNull() ? 0 : Objects.hash(getEdges(), true);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		PathDiagram other = (PathDiagram) obj;
		return isNull() == other.isNull() && getEdges().equals(other.getEdges());
	}

	@Override
	public String toString() {
		if (isNull()) {
			return "null";
		}
		StringBuilder builder = new StringBuilder("[");
		List<Edge> path = getEdges();
		for (int i = 0; i < path.size(); i++) {
			if (i > 0) {
				builder.append(", ");
			}
			builder.append(path.get(i));
		}
		return builder.append("]").toString();
	}

}
