package daddy.trans.passes.scope;

import daddy.errors.Issue;
import daddy.errors.TopLevelIssueContext;
import daddy.model.pygmy.*;
import daddy.trans.UnsupportedFeatureIssue;
import daddy.trans.passes.parse.PygmyParsingPass;
import daddy.util.SourceLocation;
import org.junit.Test;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static daddy.model.pygmy.PygmyBuilder.*;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;

public class PygmyScopingPassTest {

	private static PygmyModule scope(TopLevelIssueContext ctx, String source) {
		PygmyUnit unit = PygmyParsingPass.perform(ctx, Paths.get("TEST"), source);
		assertFalse(ctx.format(), ctx.hasErrors());
		return PygmyScopingPass.perform(ctx, unit);
	}

	private static Issue singleIssue(String source) {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		scope(ctx, source);
		List<Issue> issues = ctx.getIssues();
		assertThat(ctx.format(), issues.size(), is(1));
		return issues.get(0);
	}

	@Test
	public void resolvesDeclarations() {
		String source = String.join("\n",
				"from pygmy import int as integer, bool",
				"N = 3",
				"x: integer = 0",
				"a: int[N] = 1",
				"class P:",
				"    f: int = 2",
				"    g: bool = True",
				"class Q(P):",
				"    h: int",
				"p: Q",
				"def step(k):",
				"    global x, a",
				"    t: int = 5",
				"    x = k + t + N + p.h",
				"    a[0] += 1",
				"");
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		PygmyModule module = scope(ctx, source);
		assertFalse(ctx.format(), ctx.hasErrors());

		assertThat(module.getConstants(), is(Collections.<String, Object>singletonMap("N", 3)));
		assertThat(module.getVars().get("x"), is(intVar("x", 0)));
		assertThat(module.getVars().get("a"), is(var("a", PygmyType.INT, 3, values(1, 1, 1))));
		assertThat(module.getVars().get("p"), is(var("p", PygmyType.struct("Q"), null, null)));
		assertThat(module.getStructs().get("Q").getParents(), is(Collections.singletonList("P")));
		assertThat(module.getStructs().get("Q").getFields(), is(Arrays.asList(
				intVar("f", 2),
				var("g", PygmyType.BOOL, null, true),
				var("h", PygmyType.INT, null, null))));

		PygmyFunc expected = func("step",
				Collections.singletonList("k"),
				Arrays.asList("x", "a"),
				Collections.singletonList(intVar("step_t", 5)),
				assign(name("x"), op("+", op("+", op("+", name("k"), name("step_t")), num(3)), attr(name("p"), "h"))),
				augAssign(item(name("a"), num(0)), "+", num(1)));
		assertThat(module.getFuncs().get("step"), is(expected));
	}

	@Test
	public void builtinCallsGoThroughTheModule() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		PygmyModule module = scope(ctx, String.join("\n",
				"import pygmy as p",
				"x: int",
				"def f():",
				"    global x",
				"    x = p.int(x > 0)",
				""));
		assertFalse(ctx.format(), ctx.hasErrors());
		PygmyStatement statement = module.getFuncs().get("f").getBody().get(0);
		assertThat(statement, is(assign(name("x"),
				new PygmyCall(SourceLocation.unknown(), attr(name("pygmy"), "int"),
						Collections.singletonList(op(">", name("x"), num(0)))))));
	}

	@Test
	public void assignmentToParameter() {
		Issue issue = singleIssue("def f(x):\n    x = 1\n");
		assertThat(issue, instanceOf(IllegalAssignmentTargetIssue.class));
		IllegalAssignmentTargetIssue illegal = (IllegalAssignmentTargetIssue) issue;
		assertThat(illegal.getKind(), is(IllegalAssignmentTargetIssue.Kind.PARAMETER));
		assertThat(illegal.getAssign().getLocation().getStartLine(), is(2));
		assertThat(illegal.getAssign().getLocation().getStartColumn(), is(4));
	}

	@Test
	public void assignmentToModuleVariableWithoutGlobal() {
		Issue issue = singleIssue("x: int = 0\ndef f():\n    x = x + 1\n");
		assertThat(issue, instanceOf(IllegalAssignmentTargetIssue.class));
		assertThat(((IllegalAssignmentTargetIssue) issue).getKind(), is(IllegalAssignmentTargetIssue.Kind.NOT_GLOBAL));
	}

	@Test
	public void assignmentToLoopVariable() {
		Issue issue = singleIssue(String.join("\n",
				"def f():",
				"    for i in range(2):",
				"        i = 3",
				""));
		assertThat(issue, instanceOf(IllegalAssignmentTargetIssue.class));
		IllegalAssignmentTargetIssue illegal = (IllegalAssignmentTargetIssue) issue;
		assertThat(illegal.getKind(), is(IllegalAssignmentTargetIssue.Kind.LOOP_VARIABLE));
		assertThat(illegal.getAssign().getLocation().getStartLine(), is(3));
	}

	@Test
	public void loopVariableShadowingModuleVariable() {
		Issue issue = singleIssue(String.join("\n",
				"x: int = 7",
				"y: int = 0",
				"def f():",
				"    global y",
				"    for x in range(2):",
				"        y += x",
				"    y += x",
				""));
		assertThat(issue, instanceOf(ScopeConflictIssue.class));
		assertThat(((ScopeConflictIssue) issue).getName(), is("x"));
		assertThat(((ScopeConflictIssue) issue).getLocation().getStartLine(), is(5));
	}

	@Test
	public void parameterDeclaredGlobal() {
		Issue issue = singleIssue(String.join("\n",
				"x: int = 0",
				"def g(x):",
				"    global x",
				""));
		assertThat(issue, instanceOf(ScopeConflictIssue.class));
		ScopeConflictIssue conflict = (ScopeConflictIssue) issue;
		assertThat(conflict.getName(), is("x"));
		assertThat(conflict.getLocation().getStartLine(), is(3));
		assertThat(conflict.getPrevious().getStartLine(), is(2));
		assertThat(conflict.getPrevious().getStartColumn(), is(6));
	}

	@Test
	public void assignmentToUndeclaredName() {
		Issue issue = singleIssue("def f():\n    z = 1\n");
		assertThat(((IllegalAssignmentTargetIssue) issue).getKind(), is(IllegalAssignmentTargetIssue.Kind.UNDECLARED));
	}

	@Test
	public void undeclaredName() {
		Issue issue = singleIssue("x: int = 0\ndef f():\n    global x\n    x = y\n");
		assertThat(issue, instanceOf(UndeclaredNameIssue.class));
		PygmyName name = ((UndeclaredNameIssue) issue).getName();
		assertThat(name.getId(), is("y"));
		assertThat(name.getLocation().getStartLine(), is(4));
		assertThat(name.getLocation().getStartColumn(), is(8));
	}

	@Test
	public void undeclaredGlobal() {
		Issue issue = singleIssue("def f():\n    global y\n");
		assertThat(issue, instanceOf(UndeclaredNameIssue.class));
	}

	@Test
	public void duplicateDeclaration() {
		Issue issue = singleIssue("x: int = 0\nx: int = 1\n");
		assertThat(issue, instanceOf(ScopeConflictIssue.class));
		ScopeConflictIssue conflict = (ScopeConflictIssue) issue;
		assertThat(conflict.getName(), is("x"));
		assertThat(conflict.getLocation().getStartLine(), is(2));
		assertThat(conflict.getPrevious().getStartLine(), is(1));
	}

	@Test
	public void localAfterStatement() {
		Issue issue = singleIssue("def f():\n    pass\n    t: int = 0\n");
		assertThat(issue, instanceOf(DeclarationOrderIssue.class));
	}

	@Test
	public void localOfStructType() {
		Issue issue = singleIssue("class P:\n    f: int\ndef g():\n    q: P\n");
		assertThat(issue, instanceOf(StaticEvaluationIssue.class));
		assertThat(((StaticEvaluationIssue) issue).getReason(), is("local variables must have type int or bool"));
	}

	@Test
	public void arrayInitialiserOfWrongLength() {
		Issue issue = singleIssue("a: int[3] = [1, 2]\n");
		assertThat(issue, instanceOf(StaticEvaluationIssue.class));
	}

	@Test
	public void unknownModule() {
		Issue issue = singleIssue("import os\n");
		assertThat(issue, instanceOf(UnsupportedFeatureIssue.class));
	}

}
