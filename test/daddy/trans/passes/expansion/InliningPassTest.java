package daddy.trans.passes.expansion;

import daddy.errors.Issue;
import daddy.errors.IssueWithContext;
import daddy.errors.TopLevelIssueContext;
import daddy.model.pygmy.PygmyFunc;
import daddy.model.pygmy.PygmyModule;
import daddy.model.pygmy.PygmyStatement;
import daddy.model.pygmy.PygmyType;
import daddy.model.pygmy.PygmyUnit;
import daddy.trans.UnsupportedFeatureIssue;
import daddy.trans.passes.parse.PygmyParsingPass;
import daddy.trans.passes.scope.PygmyScopingPass;
import org.junit.Test;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static daddy.model.pygmy.PygmyBuilder.*;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;

public class InliningPassTest {

	private static PygmyModule inline(TopLevelIssueContext ctx, String source, String... entries) {
		PygmyUnit unit = PygmyParsingPass.perform(ctx, Paths.get("TEST"), source);
		assertFalse(ctx.format(), ctx.hasErrors());
		PygmyModule module = PygmyScopingPass.perform(ctx, unit);
		assertFalse(ctx.format(), ctx.hasErrors());
		return InliningPass.perform(ctx, module, Arrays.asList(entries));
	}

	private static PygmyFunc inlineMain(String source) {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		PygmyModule module = inline(ctx, source, "main");
		assertFalse(ctx.format(), ctx.hasErrors());
		return module.getFuncs().get("main");
	}

	private static Issue singleIssue(String source, String... entries) {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		inline(ctx, source, entries);
		assertThat(ctx.format(), ctx.getIssues().size(), is(1));
		return ctx.getIssues().get(0);
	}

	private static Issue unwrap(Issue issue) {
		while (issue instanceof IssueWithContext) {
			issue = ((IssueWithContext) issue).getIssue();
		}
		return issue;
	}

	@Test
	public void constantArgumentIsFolded() {
		PygmyFunc main = inlineMain(String.join("\n",
				"y: int = 0",
				"def f(x):",
				"    return x + 1",
				"def main():",
				"    global y",
				"    y = f(3)",
				""));
		assertThat(main.getBody(), is(block(assign(name("y"), num(4)))));
		assertThat(main.getParams(), is(Collections.<String>emptyList()));
		assertThat(main.getGlobals(), is(Collections.singletonList("y")));
	}

	@Test
	public void loopIsUnrolled() {
		PygmyFunc main = inlineMain(String.join("\n",
				"y: int = 0",
				"def main():",
				"    global y",
				"    for i in [0, 1, 2]:",
				"        y += i",
				""));
		assertThat(main.getBody(), is(block(
				augAssign(name("y"), "+", num(0)),
				augAssign(name("y"), "+", num(1)),
				augAssign(name("y"), "+", num(2)))));
	}

	@Test
	public void loopOverConstantRangeIndexesArrays() {
		PygmyFunc main = inlineMain(String.join("\n",
				"N = 2",
				"a: int[N]",
				"def main():",
				"    global a",
				"    for i in range(N):",
				"        if i > 0:",
				"            a[i] = a[i - 1]",
				""));
		assertThat(main.getBody(), is(block(
				assign(item(name("a"), num(1)), item(name("a"), num(0))))));
	}

	@Test
	public void variableArgumentIsCopied() {
		PygmyFunc main = inlineMain(String.join("\n",
				"y: int = 0",
				"z: int = 0",
				"def inc(v):",
				"    if v > 2:",
				"        return v",
				"    return v + 1",
				"def main():",
				"    global y, z",
				"    z = inc(y)",
				""));
		assertThat(main.getLocals(), is(Collections.singletonList(var("main_inc_v", PygmyType.INT, null, null))));
		assertThat(main.getBody(), is(block(
				assign(name("main_inc_v"), name("y")),
				ifS(op(">", name("main_inc_v"), num(2)),
						block(assign(name("z"), name("main_inc_v"))),
						block(assign(name("z"), op("+", name("main_inc_v"), num(1))))))));
	}

	@Test
	public void localsAreRenamedAndInitialisedPerCall() {
		PygmyFunc main = inlineMain(String.join("\n",
				"y: int = 0",
				"unused: int = 0",
				"def helper():",
				"    global y",
				"    t: int = 2",
				"    y += t",
				"def main():",
				"    helper()",
				"    helper()",
				""));
		assertThat(main.getLocals(), is(Collections.singletonList(intVar("main_helper_t", 2))));
		assertThat(main.getBody(), is(block(
				assign(name("main_helper_t"), num(2)),
				augAssign(name("y"), "+", name("main_helper_t")),
				assign(name("main_helper_t"), num(2)),
				augAssign(name("y"), "+", name("main_helper_t")))));
	}

	@Test
	public void unreferencedDeclarationsAreDropped() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		PygmyModule module = inline(ctx, String.join("\n",
				"y: int = 0",
				"unused: int = 0",
				"def other():",
				"    global unused",
				"    unused = 1",
				"def main():",
				"    global y",
				"    y = 1",
				""), "main");
		assertFalse(ctx.format(), ctx.hasErrors());
		assertThat(module.getVars().keySet(), is(Collections.singleton("y")));
		assertThat(module.getFuncs().keySet(), is(Collections.singleton("main")));
	}

	@Test
	public void recursion() {
		Issue issue = singleIssue(String.join("\n",
				"def f():",
				"    f()",
				"def main():",
				"    f()",
				""), "main");
		assertThat(issue, instanceOf(IssueWithContext.class));
		assertThat(((IssueWithContext) issue).getContext(), instanceOf(InliningCall.class));
		assertThat(unwrap(issue), instanceOf(RecursiveCallIssue.class));
	}

	@Test
	public void mutualRecursion() {
		Issue issue = singleIssue(String.join("\n",
				"def f():",
				"    g()",
				"def g():",
				"    f()",
				"def main():",
				"    f()",
				""), "main");
		List<String> calls = new ArrayList<>();
		while (issue instanceof IssueWithContext) {
			calls.add(((InliningCall) ((IssueWithContext) issue).getContext()).getFunction());
			issue = ((IssueWithContext) issue).getIssue();
		}
		assertThat(calls, is(Arrays.asList("f", "g")));
		assertThat(issue, instanceOf(RecursiveCallIssue.class));
		assertThat(((RecursiveCallIssue) issue).getFunction(), is("f"));
	}

	@Test
	public void argumentCountMismatch() {
		Issue issue = singleIssue(String.join("\n",
				"def g(a):",
				"    pass",
				"def main():",
				"    g()",
				""), "main");
		assertThat(issue, instanceOf(CallArgumentCountMismatchIssue.class));
	}

	@Test
	public void nestedCall() {
		Issue issue = singleIssue(String.join("\n",
				"y: int = 0",
				"def g():",
				"    return 1",
				"def main():",
				"    global y",
				"    y = g() + 1",
				""), "main");
		assertThat(issue, instanceOf(NestedCallIssue.class));
	}

	@Test
	public void missingReturn() {
		Issue issue = singleIssue(String.join("\n",
				"y: int = 0",
				"def g(a):",
				"    if a > 0:",
				"        return 1",
				"def main():",
				"    global y",
				"    y = g(y)",
				""), "main");
		assertThat(unwrap(issue), instanceOf(MissingReturnIssue.class));
	}

	@Test
	public void bareReturnWhereValueExpected() {
		Issue issue = singleIssue(String.join("\n",
				"y: int = 0",
				"def g():",
				"    return",
				"def main():",
				"    global y",
				"    y = g()",
				""), "main");
		assertThat(unwrap(issue), instanceOf(ReturnValueMismatchIssue.class));
		ReturnValueMismatchIssue mismatch = (ReturnValueMismatchIssue) unwrap(issue);
		assertThat(mismatch.getFunction(), is("g"));
		assertThat(mismatch.isValueExpected(), is(true));
	}

	@Test
	public void defaultEntriesSkipFunctionsReturningValues() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		PygmyUnit unit = PygmyParsingPass.perform(ctx, Paths.get("TEST"), String.join("\n",
				"x: int = 0",
				"def two():",
				"    return 2",
				"def step(k):",
				"    global x",
				"    x += k",
				"def maybe():",
				"    global x",
				"    if x > 3:",
				"        return",
				"    x += two()",
				"def main():",
				"    step(two())",
				""));
		PygmyModule module = PygmyScopingPass.perform(ctx, unit);
		assertFalse(ctx.format(), ctx.hasErrors());
		assertThat(InliningPass.defaultEntries(module), is(Arrays.asList("maybe", "main")));
	}

	@Test
	public void entryReturningValue() {
		Issue issue = singleIssue("def main():\n    return 1\n", "main");
		assertThat(issue, instanceOf(ReturnValueMismatchIssue.class));
	}

	@Test
	public void entryWithParameters() {
		Issue issue = singleIssue("def main(a):\n    pass\n", "main");
		assertThat(issue, instanceOf(UnsupportedFeatureIssue.class));
	}

	@Test
	public void unknownEntry() {
		Issue issue = singleIssue("def main():\n    pass\n", "nope");
		assertThat(issue, instanceOf(UnknownEntryFunctionIssue.class));
	}

	@Test
	public void returnNormalisationMovesTheRestIntoBranches() {
		List<PygmyStatement> normalized = PygmyReturnNormalizer.normalize(block(
				ifS(name("c"), block(returnS(num(1))), Collections.emptyList()),
				assign(name("x"), num(2)),
				returnS(name("x"))));
		assertThat(normalized, is(block(
				ifS(name("c"),
						block(returnS(num(1))),
						block(assign(name("x"), num(2)), returnS(name("x")))))));
		assertThat(PygmyReturnNormalizer.alwaysReturns(normalized), is(true));
	}

}
