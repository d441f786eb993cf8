package daddy;

import daddy.model.ddd.Edge;
import daddy.model.ddd.PathDiagram;
import daddy.model.ddd.PathSet;
import daddy.model.ddd.VariableOrder;
import daddy.model.hom.Hom;
import daddy.model.pygmy.PygmyModule;
import daddy.trans.DaddyTransException;
import org.apache.commons.io.IOUtils;
import org.junit.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class DaddyTest {

	private static final VariableOrder ORDER = VariableOrder.of("x", "y", "a[0]", "a[1]");

	private static String fixture(String name) throws IOException {
		try (InputStream in = DaddyTest.class.getResourceAsStream("/daddy/" + name)) {
			return IOUtils.toString(in, StandardCharsets.UTF_8);
		}
	}

	private static PathDiagram state(int x, int y, int a0, int a1) {
		return PathDiagram.of(new Edge("x", x), new Edge("y", y), new Edge("a[0]", a0), new Edge("a[1]", a1));
	}

	// the result of the one action enabled on the path
	private static PathDiagram fire(List<Hom> actions, PathDiagram path) {
		PathDiagram result = PathDiagram.nullPath();
		for (Hom action : actions) {
			PathDiagram next = PathDiagram.from(action.apply(path));
			if (!next.isNull()) {
				assertTrue("more than one action enabled", result.isNull());
				result = next;
			}
		}
		return result;
	}

	private static PathDiagram apply(String text, PathDiagram path) {
		return PathDiagram.from(Daddy.hom(ORDER, text).apply(path));
	}

	@Test
	public void textualAssignments() {
		PathDiagram start = state(1, 2, 3, 4);
		assertThat(apply("x = 3", start), is(state(3, 2, 3, 4)));
		assertThat(apply("x += y", start), is(state(3, 2, 3, 4)));
		assertThat(apply("y -= 2*x + 1", start), is(state(1, -1, 3, 4)));
		assertThat(apply("a[1] = 2*y + a[0] - x", start), is(state(1, 2, 3, 6)));
		assertThat(apply("x = a[1]", start), is(state(4, 2, 3, 4)));
		assertThat(apply("y = y", start), is(start));
	}

	@Test
	public void textualSelectors() {
		PathDiagram start = state(1, 2, 3, 4);
		assertThat(apply("x <= y + 2", start), is(start));
		assertTrue(apply("x > y", start).isNull());
		assertThat(apply("x < y and a[0] != a[1]", start), is(start));
		assertTrue(apply("not (x < y)", start).isNull());
		assertTrue(apply("1 > 2", start).isNull());
		assertThat(apply("True", start), is(start));
	}

	@Test
	public void selectorsMustBeConjunctions() {
		try {
			Daddy.hom(ORDER, "x == 0 or y == 0");
			fail("expected a disjunction to be rejected");
		} catch (DaddyTransException e) {
			assertThat(e.getMessage(), containsString("unsupported disjunction in a selector"));
		}
	}

	@Test
	public void nonLinearText() {
		try {
			Daddy.hom(ORDER, "x = x * y");
			fail("expected a product of variables to be rejected");
		} catch (DaddyTransException e) {
			assertThat(e.getMessage(), containsString("non-linear expression: product of two variables"));
		}
	}

	@Test
	public void unknownVariableInText() {
		try {
			Daddy.hom(ORDER, "z = 1");
			fail("expected an unknown variable to be rejected");
		} catch (DaddyTransException e) {
			assertThat(e.getPrefix(), is("Translation Error"));
		}
	}

	@Test
	public void compilesEveryParameterlessFunction() throws IOException {
		String source = fixture("counter.py");
		Map<String, List<Hom>> compiled = Daddy.compile(source, Collections.emptyList());
		assertThat(new ArrayList<>(compiled.keySet()), is(Arrays.asList("take0", "take1")));
		assertThat(compiled.get("take0").size(), is(2));

		PygmyModule module = Daddy.parse(source);
		VariableOrder order = VariableOrder.fromModule(module);
		assertThat(order.getVariables(), is(Arrays.asList("budget", "counts[0]", "counts[1]")));

		PathDiagram initial = VariableOrder.initialState(module);
		assertThat(initial, is(PathDiagram.of(new Edge("budget", 3), new Edge("counts[0]", 0),
				new Edge("counts[1]", 0))));
		PathDiagram afterTake1 = fire(compiled.get("take1"), initial);
		assertThat(afterTake1, is(PathDiagram.of(new Edge("budget", 2), new Edge("counts[0]", 0),
				new Edge("counts[1]", 1))));

		List<Hom> all = new ArrayList<>();
		compiled.values().forEach(all::addAll);
		PathSet reachable = PathSet.of(initial).reachable(all);
		// budget + counts[0] + counts[1] stays 3
		assertThat(reachable.size(), is(10));
		for (PathDiagram path : reachable) {
			assertThat(path.get("budget") + path.get("counts[0]") + path.get("counts[1]"), is(3));
		}
	}

	@Test
	public void helpersReturningValuesAreNotEntries() {
		String source = String.join("\n",
				"x: int = 0",
				"def two():",
				"    return 2",
				"def main():",
				"    global x",
				"    if x < 4:",
				"        x += two()",
				"");
		Map<String, List<Hom>> compiled = Daddy.compile(source, Collections.emptyList());
		assertThat(new ArrayList<>(compiled.keySet()), is(Collections.singletonList("main")));
		PathDiagram initial = VariableOrder.initialState(Daddy.parse(source));
		assertThat(fire(compiled.get("main"), initial), is(PathDiagram.of(new Edge("x", 2))));
	}

	@Test
	public void selectedEntriesOnly() throws IOException {
		Map<String, List<Hom>> compiled = Daddy.compile(fixture("counter.py"), Collections.singletonList("take1"));
		assertThat(new ArrayList<>(compiled.keySet()), is(Collections.singletonList("take1")));
	}

	@Test
	public void reportsEveryIssueOfTheFailingPass() {
		try {
			Daddy.parse("def f(x):\n    x = 1\n    y = 2\n");
			fail("expected scope errors");
		} catch (DaddyTransException e) {
			assertThat(e.getMsg(), containsString("Detected 2 issue(s)"));
		}
	}

	@Test(expected = DaddyTransException.class)
	public void syntaxError() {
		Daddy.parse("def f(:\n    pass\n");
	}

}
