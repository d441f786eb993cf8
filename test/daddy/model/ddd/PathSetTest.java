package daddy.model.ddd;

import daddy.Daddy;
import daddy.model.hom.Comparator;
import daddy.model.hom.Condition;
import daddy.model.hom.Hom;
import daddy.model.hom.WeightedSum;
import daddy.trans.passes.synthesis.HomSynthesizer;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class PathSetTest {

	private static final VariableOrder ORDER = VariableOrder.of("x", "y");

	private static PathDiagram state(int x, int y) {
		return PathDiagram.of(new Edge("x", x), new Edge("y", y));
	}

	@Test
	public void applyDropsRejectedPaths() throws Exception {
		Hom positive = Daddy.hom(ORDER, "x > 0");
		PathSet set = PathSet.of(state(0, 1), state(2, 3));
		assertThat(set.apply(positive), is(PathSet.of(state(2, 3))));
	}

	@Test
	public void unionKeepsEachPathOnce() {
		PathSet left = PathSet.of(state(0, 1), state(2, 3));
		PathSet right = PathSet.of(state(2, 3), state(4, 5), PathDiagram.nullPath());
		PathSet union = left.union(right);
		assertThat(union.size(), is(3));
		assertThat(union, is(PathSet.of(state(4, 5), state(2, 3), state(0, 1))));
		assertTrue(left.union(PathSet.of()).equals(left));
	}

	@Test
	public void reachableIsTheFixpoint() {
		// x counts up to 3, y follows x
		Hom increment = Daddy.synthesize(ORDER,
				Collections.singletonList(new Condition(
						WeightedSum.of(ORDER, Collections.singletonMap("x", 1), -3),
						Comparator.LT)),
				Collections.singletonMap("x",
						WeightedSum.of(ORDER, Collections.singletonMap("x", 1), 1)));
		Hom copy = HomSynthesizer.ass(ORDER, "y", "x", false, 0, 1);
		PathSet reachable = PathSet.of(state(0, 0)).reachable(Arrays.asList(increment, copy));
		for (int x = 0; x <= 3; x++) {
			assertTrue(reachable.contains(state(x, x)));
		}
		assertTrue(reachable.contains(state(3, 2)));
		assertFalse(reachable.contains(state(4, 4)));
		// y only ever holds a value x held before
		assertThat(reachable.size(), is(10));
	}

	@Test
	public void pathsKnowTheirValues() {
		PathDiagram path = state(4, -1);
		assertThat(path.get("y"), is(-1));
		assertThat(path.getTail().getHead(), is(new Edge("y", -1)));
		assertTrue(PathDiagram.from(path.getTail().getTail()).isOne());
		assertTrue(PathDiagram.nullPath().prepend(new Edge("x", 1)).isNull());
	}

}
