package daddy.model.hom;

import daddy.InternalCompilerError;
import daddy.model.ddd.VariableOrder;
import org.junit.Test;

import java.util.HashMap;
import java.util.Map;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class WeightedSumTest {

	private static final VariableOrder ORDER = VariableOrder.of("a", "b", "c");

	private static WeightedSum sum(int a, int b, int c, int constant) {
		Map<String, Integer> coefficients = new HashMap<>();
		coefficients.put("c", c);
		coefficients.put("a", a);
		coefficients.put("b", b);
		return WeightedSum.of(ORDER, coefficients, constant);
	}

	@Test
	public void pushingEveryVariableGivesTheSubstitutedValue() {
		int[][] values = {{0, 0, 0}, {1, 2, 3}, {-4, 7, 0}, {10, -10, 5}};
		for (int[] v : values) {
			WeightedSum s = sum(2, -3, 5, 7);
			s = s.push("a", v[0]).push("b", v[1]).push("c", v[2]);
			assertTrue(s.isDone());
			assertThat(s.value(), is(2 * v[0] - 3 * v[1] + 5 * v[2] + 7));
		}
	}

	@Test
	public void termsFollowTheVariableOrder() {
		WeightedSum s = sum(1, 0, 4, 0);
		assertThat(s.nextVariable(), is("a"));
		assertFalse(s.mentions("b"));
		assertThat(s.push("a", 3).nextVariable(), is("c"));
		assertThat(s.toString(), is("a + 4*c"));
	}

	@Test
	public void feedSkipsVariablesNotMentioned() {
		WeightedSum s = sum(0, 2, 0, 1);
		assertThat(s.feed("a", 100), is(s));
		assertThat(s.feed("b", 3).value(), is(7));
	}

	@Test(expected = InternalCompilerError.class)
	public void pushOutOfOrder() {
		sum(1, 1, 0, 0).push("b", 1);
	}

	@Test(expected = InternalCompilerError.class)
	public void pushIntoResolvedSum() {
		WeightedSum.constant(3).push("a", 1);
	}

	@Test(expected = InternalCompilerError.class)
	public void valueOfUnresolvedSum() {
		WeightedSum.identity("a").value();
	}

	@Test(expected = InternalCompilerError.class)
	public void unknownVariable() {
		Map<String, Integer> coefficients = new HashMap<>();
		coefficients.put("z", 1);
		WeightedSum.of(ORDER, coefficients, 0);
	}

	@Test
	public void conditionsCompareAgainstZero() {
		Condition condition = new Condition(sum(1, -1, 0, 0), Comparator.LE);
		assertTrue(condition.feed("a", 2).feed("b", 3).holds());
		assertFalse(condition.feed("a", 4).feed("b", 3).holds());
		assertTrue(condition.negate().feed("a", 4).feed("b", 3).holds());
	}

}
