package daddy.model.ddd;

import daddy.model.hom.Hom;

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A finite set of states, each one a path. Homomorphisms are applied path by path.
 */
public final class PathSet implements Iterable<PathDiagram> {

	private final Set<PathDiagram> paths;

	public PathSet(Collection<PathDiagram> paths) {
		Set<PathDiagram> result = new LinkedHashSet<>();
		for (PathDiagram path : paths) {
			if (!path.isNull()) {
				result.add(path);
			}
		}
		this.paths = Collections.unmodifiableSet(result);
	}

	public static PathSet of(PathDiagram... paths) {
		Set<PathDiagram> result = new LinkedHashSet<>();
		Collections.addAll(result, paths);
		return new PathSet(result);
	}

	public Set<PathDiagram> getPaths() {
		return paths;
	}

	public int size() {
		return paths.size();
	}

	public boolean isEmpty() {
		return paths.isEmpty();
	}

	public boolean contains(PathDiagram path) {
		return paths.contains(path);
	}

	public PathSet apply(Hom hom) {
		Set<PathDiagram> result = new LinkedHashSet<>();
		for (PathDiagram path : paths) {
			result.add(PathDiagram.from(hom.apply(path)));
		}
		return new PathSet(result);
	}

	public PathSet union(PathSet other) {
		Set<PathDiagram> result = new LinkedHashSet<>(paths);
		result.addAll(other.paths);
		return new PathSet(result);
	}

	/**
	 * @return every state reachable from this set by applying the homomorphisms any number of times
	 */
	public PathSet reachable(Collection<? extends Hom> homs) {
		PathSet result = this;
		PathSet frontier = this;
		while (!frontier.isEmpty()) {
			PathSet image = new PathSet(Collections.emptySet());
			for (Hom hom : homs) {
				image = image.union(frontier.apply(hom));
			}
			Set<PathDiagram> fresh = new LinkedHashSet<>(image.paths);
			fresh.removeAll(result.paths);
			frontier = new PathSet(fresh);
			result = result.union(frontier);
		}
		return result;
	}

	@Override
	public Iterator<PathDiagram> iterator() {
		return paths.iterator();
	}

	@Override
	public int hashCode() {
		return Objects.hash(paths);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		return paths.equals(((PathSet) obj).paths);
	}

	@Override
	public String toString() {
		return paths.toString();
	}

}
