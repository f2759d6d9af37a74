package nl.utwente.ewi.fmt.SC2JANI.statechart;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import nl.utwente.ewi.fmt.SC2JANI.Assignment;
import nl.utwente.ewi.fmt.SC2JANI.Automaton;
import nl.utwente.ewi.fmt.SC2JANI.CompilationException;
import nl.utwente.ewi.fmt.SC2JANI.Destination;
import nl.utwente.ewi.fmt.SC2JANI.Edge;
import nl.utwente.ewi.fmt.SC2JANI.ExpressionTypeException;
import nl.utwente.ewi.fmt.SC2JANI.JaniModel.JaniBaseType;
import nl.utwente.ewi.fmt.SC2JANI.JaniModel.JaniType;
import nl.utwente.ewi.fmt.SC2JANI.JaniModel.JaniVariable;
import nl.utwente.ewi.fmt.SC2JANI.ModelException;
import nl.utwente.ewi.fmt.SC2JANI.expression.ArrayValueExpression;
import nl.utwente.ewi.fmt.SC2JANI.expression.ConstantExpression;
import nl.utwente.ewi.fmt.SC2JANI.expression.Expression;
import nl.utwente.ewi.fmt.SC2JANI.expression.ExpressionParser;
import nl.utwente.ewi.fmt.SC2JANI.expression.Operator;
import nl.utwente.ewi.fmt.SC2JANI.expression.OperatorExpression;

import static org.junit.jupiter.api.Assertions.*;

public class AutomatonBuilderTest
{
	private final EventRegistry events = new EventRegistry();

	private static List<DataDeclaration> data(DataDeclaration... ds) {
		return List.of(ds);
	}

	private static StateChart chart(String name, List<DataDeclaration> data, State... states) {
		return new StateChart(name, null, data, List.of(states));
	}

	private Automaton build(StateChart chart) {
		return AutomatonBuilder.build(chart, events, 4);
	}

	private static Transition on(String event, String cond, String target, ExecutableEntry... body) {
		return new Transition(event, cond, target, List.of(body));
	}

	private static List<Edge> edgesFrom(Automaton a, String location) {
		ArrayList<Edge> ret = new ArrayList<>();
		for (Edge e : a.getEdges()) {
			if (e.location.equals(location))
				ret.add(e);
		}
		return ret;
	}

	private static Edge edge(Automaton a, String location, String action) {
		for (Edge e : a.getEdges()) {
			if (e.location.equals(location) && action.equals(e.action))
				return e;
		}
		fail("No edge from " + location + " on " + action + " in " + a.getEdges());
		return null;
	}

	private static Expression parse(String s) {
		return ExpressionParser.parse(s);
	}

	private static Expression not(Expression e) {
		return new OperatorExpression(Operator.NOT, e);
	}

	@Test
	void eventTransitionWithAssignment() {
		Automaton a = build(chart("counter",
				data(new DataDeclaration("x", "int32", "0")),
				new State("idle", List.of(on("go", null, "busy", new Assign("x", "x + 1")))),
				new State("busy", List.of(on("stop", null, "idle")))));
		assertEquals("idle", a.getInitialLocation());
		Edge go = edge(a, "idle", "go_on_receive");
		assertNull(go.getGuard());
		assertEquals(1, go.getDestinations().size());
		Destination d = go.getDestinations().get(0);
		assertEquals("busy", d.getLocation());
		assertNull(d.getProbability());
		assertEquals(1, d.getAssignments().size());
		Assignment x = d.getAssignments().get(0);
		assertEquals("x", x.getVariable());
		assertEquals(parse("x + 1"), x.value);
		assertEquals(0, x.index);

		Event e = events.get("go");
		assertEquals("go_on_receive", e.getReceivers().get("counter"));
		assertTrue(e.getSenders().isEmpty());
	}

	@Test
	void unhandledEventsGetSelfLoops() {
		Automaton a = build(chart("counter", data(),
				new State("idle", List.of(on("go", null, "busy"))),
				new State("busy", List.of(on("stop", null, "idle")))));
		Edge loop = edge(a, "busy", "go_on_receive");
		assertNull(loop.getGuard());
		assertEquals("busy", loop.getDestinations().get(0).getLocation());
		assertTrue(loop.getDestinations().get(0).getAssignments().isEmpty());
		edge(a, "idle", "stop_on_receive");
		/* No loops for the events a state handles unconditionally. */
		assertEquals(2, edgesFrom(a, "idle").size());
		assertEquals(2, edgesFrom(a, "busy").size());
	}

	@Test
	void conditionalTransitionsExcludeEarlierOnes() {
		Automaton a = build(chart("guarded",
				data(new DataDeclaration("x", "int32", "0")),
				new State("idle", List.of(
						on("e", "x > 0", "pos"),
						on("e", "x < -5", "neg"))),
				new State("pos", List.of()),
				new State("neg", List.of())));
		List<Edge> fromIdle = edgesFrom(a, "idle");
		assertEquals(3, fromIdle.size());
		Expression c1 = parse("x > 0"), c2 = parse("x < -5");
		assertEquals(c1, fromIdle.get(0).getGuard());
		assertEquals(new OperatorExpression(Operator.AND, c2, not(c1)), fromIdle.get(1).getGuard());
		Edge loop = fromIdle.get(2);
		assertEquals("e_on_receive", loop.action);
		assertEquals(new OperatorExpression(Operator.AND, not(c1), not(c2)), loop.getGuard());
		assertEquals("idle", loop.getDestinations().get(0).getLocation());
		/* States without transitions block nothing. */
		assertNull(edge(a, "pos", "e_on_receive").getGuard());
	}

	@Test
	void mergeGuards() {
		Expression a = parse("a"), b = parse("b"), c = parse("c");
		assertNull(AutomatonBuilder.merge(List.of(), null));
		assertEquals(c, AutomatonBuilder.merge(List.of(), c));
		assertEquals(not(a), AutomatonBuilder.merge(List.of(a), null));
		assertEquals(new OperatorExpression(Operator.AND,
				new OperatorExpression(Operator.AND, c, not(a)), not(b)),
				AutomatonBuilder.merge(List.of(a, b), c));
	}

	@Test
	void eventDataInGuard() {
		Automaton a = build(chart("listener", data(),
				new State("idle", List.of(on("msg", "_event.n > 1", "done"))),
				new State("done", List.of())));
		assertEquals(parse("msg.n > 1"), edge(a, "idle", "msg_on_receive").getGuard());
	}

	@Test
	void eventlessTransitionNames() {
		Automaton a = build(chart("auto",
				data(new DataDeclaration("x", "int32", "0")),
				new State("s0", List.of(on(null, "x > 2", "s1"), on(null, null, "s1"))),
				new State("s1", List.of())));
		String conditional = "transition-s0-eventless-" + AutomatonBuilder.hash("s0", "x > 2");
		String otherwise = "transition-s0-eventless-" + AutomatonBuilder.hash("s0", "null");
		assertEquals(parse("x > 2"), edge(a, "s0", conditional).getGuard());
		assertEquals(not(parse("x > 2")), edge(a, "s0", otherwise).getGuard());
	}

	@Test
	void hashIsStable() {
		String h = AutomatonBuilder.hash("a", "b");
		assertEquals(8, h.length());
		assertTrue(h.matches("[0-9a-f]{8}"));
		assertEquals(h, AutomatonBuilder.hash("a", "b"));
		assertEquals(h, AutomatonBuilder.hash("a/b"));
		assertNotEquals(h, AutomatonBuilder.hash("b", "a"));
	}

	@Test
	void probabilisticTargets() {
		List<Transition.Target> targets = List.of(
				new Transition.Target("heads", 0.25, List.of()),
				new Transition.Target("tails", List.of()));
		Automaton a = build(chart("coin", data(),
				new State("flip", List.of(new Transition("toss", null, targets))),
				new State("heads", List.of()),
				new State("tails", List.of())));
		Edge toss = edge(a, "flip", "toss_on_receive");
		List<Destination> ds = toss.getDestinations();
		assertEquals(2, ds.size());
		assertEquals("heads", ds.get(0).getLocation());
		assertEquals(new ConstantExpression(0.25), ds.get(0).getProbability());
		assertEquals("tails", ds.get(1).getLocation());
		assertEquals(new ConstantExpression(0.75), ds.get(1).getProbability());
	}

	@Test
	void probabilisticTargetNames() {
		List<Transition.Target> targets = List.of(
				new Transition.Target("heads", 0.25, List.of(new Send("flipped", List.of()))),
				new Transition.Target("tails", List.of(new Send("flipped", List.of()))));
		Automaton a = build(chart("coin", data(),
				new State("flip", List.of(new Transition("toss", null, targets))),
				new State("heads", List.of()),
				new State("tails", List.of())));
		String h1 = AutomatonBuilder.hash("flip", "heads", "toss_on_receive", "null", "0.25");
		String h2 = AutomatonBuilder.hash("flip", "tails", "toss_on_receive", "null", "1.0");
		List<Destination> ds = edge(a, "flip", "toss_on_receive").getDestinations();
		assertEquals("flip-" + h1 + "-0", ds.get(0).getLocation());
		assertEquals("flip-" + h2 + "-0", ds.get(1).getLocation());
		assertEquals("heads", edge(a, "flip-" + h1 + "-0", "flipped_on_send").getDestinations().get(0).getLocation());
	}

	@Test
	void invalidProbabilities() {
		State target = new State("t", List.of());
		StateChart tooMuch = chart("p1", data(),
				new State("s", List.of(new Transition("e", null,
						List.of(new Transition.Target("t", 1.2, List.of()))))),
				target);
		assertThrows(ModelException.class, () -> build(tooMuch));
		StateChart tooLittle = chart("p2", data(),
				new State("s", List.of(new Transition("e", null, List.of(
						new Transition.Target("s", 0.5, List.of()),
						new Transition.Target("t", 0.3, List.of()))))),
				target);
		assertThrows(ModelException.class, () -> build(tooLittle));
		StateChart nothingLeft = chart("p3", data(),
				new State("s", List.of(new Transition("e", null, List.of(
						new Transition.Target("s", 1.0, List.of()),
						new Transition.Target("t", List.of()))))),
				target);
		assertThrows(ModelException.class, () -> build(nothingLeft));
	}

	@Test
	void sendSplitsTransition() {
		Automaton a = build(chart("sender",
				data(new DataDeclaration("x", "int32", "3")),
				new State("idle", List.of(on("go", null, "busy",
						new Assign("x", "x + 1"),
						new Send("ping", List.of(new Send.Param("value", "x")))))),
				new State("busy", List.of())));
		String h = AutomatonBuilder.hash("idle", "busy", "go_on_receive", "null", "1.0");
		String interm = "idle-" + h + "-0";
		assertTrue(a.hasLocation(interm));

		Destination first = edge(a, "idle", "go_on_receive").getDestinations().get(0);
		assertEquals(interm, first.getLocation());
		assertEquals(1, first.getAssignments().size());

		Edge send = edge(a, interm, "ping_on_send");
		Destination d = send.getDestinations().get(0);
		assertEquals("busy", d.getLocation());
		List<Assignment> as = d.getAssignments();
		assertEquals(2, as.size());
		assertEquals("ping.value", as.get(0).getVariable());
		assertEquals(parse("x"), as.get(0).value);
		assertEquals("ping.valid", as.get(1).getVariable());
		assertEquals(ConstantExpression.TRUE, as.get(1).value);
		assertEquals(0, as.get(1).index);

		Event ping = events.get("ping");
		assertEquals("ping_on_send", ping.getSenders().get("sender"));
		assertEquals(new JaniType(JaniBaseType.INTEGER), ping.getDataStructure().get("value"));
	}

	@Test
	void sendArrayLiteral() {
		Automaton a = build(chart("sender", data(),
				new State("idle", List.of(on(null, null, "idle",
						new Send("path", List.of(new Send.Param("points", "[1.5, 2]"))))))));
		Edge send = null;
		for (Edge e : a.getEdges()) {
			if ("path_on_send".equals(e.action))
				send = e;
		}
		assertNotNull(send);
		List<Assignment> as = send.getDestinations().get(0).getAssignments();
		assertEquals(3, as.size());
		ArrayValueExpression padded = (ArrayValueExpression)as.get(0).value;
		assertEquals(4, padded.length());
		assertEquals(new ConstantExpression(0.0), padded.elements.get(3));
		assertEquals("path.points.d1_len", as.get(1).getVariable());
		assertEquals(new ConstantExpression(2L), as.get(1).value);
		assertEquals(new JaniType(JaniBaseType.REAL, List.of(4)),
		             events.get("path").getDataStructure().get("points"));
	}

	@Test
	void sendTypeFromGlobals() {
		StateChart c = chart("sender", data(),
				new State("idle", List.of(on(null, null, "idle",
						new Send("report", List.of(new Send.Param("v", "speed * 2")))))));
		AutomatonBuilder b = new AutomatonBuilder(c, events, 4);
		b.declareGlobal("speed", new JaniType(JaniBaseType.REAL));
		b.build();
		assertEquals(new JaniType(JaniBaseType.REAL), events.get("report").getDataStructure().get("v"));
	}

	@Test
	void sendOfUnknownType() {
		StateChart c = chart("sender", data(),
				new State("idle", List.of(on(null, null, "idle",
						new Send("report", List.of(new Send.Param("v", "mystery + 1")))))));
		assertThrows(ExpressionTypeException.class, () -> build(c));
	}

	private static StateChart sender(String name, String event, String field, String value) {
		return chart(name, data(),
				new State("idle", List.of(on(null, null, "idle",
						new Send(event, List.of(new Send.Param(field, value)))))));
	}

	@Test
	void sendersWidenFieldType() {
		build(sender("first", "e", "x", "1"));
		assertEquals(new JaniType(JaniBaseType.INTEGER), events.get("e").getDataStructure().get("x"));
		build(sender("second", "e", "x", "1.5"));
		assertEquals(new JaniType(JaniBaseType.REAL), events.get("e").getDataStructure().get("x"));
		build(sender("third", "e", "x", "2"));
		assertEquals(new JaniType(JaniBaseType.REAL), events.get("e").getDataStructure().get("x"));
		assertEquals(3, events.get("e").getSenders().size());
	}

	@Test
	void sendersDisagreeOnFieldType() {
		build(sender("first", "e", "x", "1"));
		ExpressionTypeException e = assertThrows(ExpressionTypeException.class,
				() -> build(sender("second", "e", "x", "true")));
		assertTrue(e.getMessage().contains("Field x of event e"), e.getMessage());
		assertThrows(ExpressionTypeException.class, () -> build(sender("third", "e", "x", "[1, 2]")));
		assertEquals(new JaniType(JaniBaseType.INTEGER), events.get("e").getDataStructure().get("x"));
	}

	@Test
	void inferTypes() {
		StateChart c = chart("types", data(
				new DataDeclaration("n", "int32", "0"),
				new DataDeclaration("r", "float64", "0.5"),
				new DataDeclaration("m", "int32[3][2]", null)),
				new State("s", List.of()));
		AutomatonBuilder b = new AutomatonBuilder(c, events, 4);
		b.build();
		assertEquals(new JaniType(JaniBaseType.INTEGER), b.inferType(parse("n % 2 + 1")));
		assertEquals(new JaniType(JaniBaseType.REAL), b.inferType(parse("n + r")));
		assertEquals(new JaniType(JaniBaseType.REAL), b.inferType(parse("n / 2")));
		assertEquals(new JaniType(JaniBaseType.BOOLEAN), b.inferType(parse("n > r")));
		assertEquals(new JaniType(JaniBaseType.INTEGER, List.of(2)), b.inferType(parse("m[1]")));
		assertEquals(new JaniType(JaniBaseType.INTEGER), b.inferType(parse("Math.floor(r)")));
		assertNull(b.inferType(parse("q + 1")));
	}

	@Test
	void conditionalBody() {
		If stmt = new If(List.of(new If.Branch("x > 0", List.of(new Assign("y", "1")))),
		                 List.of(new Assign("y", "2")));
		Automaton a = build(chart("branching",
				data(new DataDeclaration("x", "int32", "0"), new DataDeclaration("y", "int32", "0")),
				new State("idle", List.of(on("go", null, "done", stmt))),
				new State("done", List.of())));
		String h = AutomatonBuilder.hash("idle", "done", "go_on_receive", "null", "1.0");
		String base = "idle-" + h + "-0";
		String before = base + AutomatonBuilder.BEFORE_IF_SUFFIX;
		String after = base + AutomatonBuilder.AFTER_IF_SUFFIX;
		assertTrue(a.hasLocation(before));
		assertTrue(a.hasLocation(after));
		assertEquals(before, edge(a, "idle", "go_on_receive").getDestinations().get(0).getLocation());

		String ifHash = AutomatonBuilder.hash(before, "x > 0");
		String prefix = before + "-" + after + "-parent-" + h + "-" + ifHash + "-";
		Edge then = edge(a, before, prefix + "0");
		Edge otherwise = edge(a, before, prefix + "1");
		assertEquals(parse("x > 0"), then.getGuard());
		assertEquals(not(parse("x > 0")), otherwise.getGuard());
		assertEquals(after, then.getDestinations().get(0).getLocation());
		assertEquals(new ConstantExpression(1L), then.getDestinations().get(0).getAssignments().get(0).value);
		assertEquals(new ConstantExpression(2L), otherwise.getDestinations().get(0).getAssignments().get(0).value);

		Edge resume = edge(a, after, "idle-done-" + h);
		assertEquals("done", resume.getDestinations().get(0).getLocation());
		assertEquals(2, edgesFrom(a, before).size());
	}

	@Test
	void arrayDeclarations() {
		Automaton a = build(chart("arrays", data(
				new DataDeclaration("a", "int32[5]", "[1, 2, 3]"),
				new DataDeclaration("m", "float64[2][]", "[[1.0], []]"),
				new DataDeclaration("s", "string", "'ok'")),
				new State("s0", List.of())));
		JaniVariable arr = a.getVariable("a");
		assertEquals(List.of(5), arr.type.sizes);
		assertEquals(5, ((ArrayValueExpression)arr.initial).length());
		assertEquals(new ConstantExpression(3L), a.getVariable("a.d1_len").initial);

		JaniVariable m = a.getVariable("m");
		assertEquals(List.of(2, 4), m.type.sizes);
		assertEquals(new ConstantExpression(2L), a.getVariable("m.d1_len").initial);
		JaniVariable rows = a.getVariable("m.d2_len");
		assertEquals(List.of(2), rows.type.sizes);
		assertEquals(new ArrayValueExpression(List.of(new ConstantExpression(1L), ConstantExpression.ZERO)),
		             rows.initial);

		assertEquals(List.of(4), a.getVariable("s").type.sizes);
		assertEquals(new ConstantExpression(2L), a.getVariable("s.d1_len").initial);
	}

	@Test
	void elementWriteExtendsArray() {
		Automaton a = build(chart("arrays",
				data(new DataDeclaration("a", "int32[5]", "[1, 2, 3]")),
				new State("s0", List.of(on("set", null, "s0", new Assign("a[4]", "9"))))));
		List<Assignment> as = edge(a, "s0", "set_on_receive").getDestinations().get(0).getAssignments();
		assertEquals(2, as.size());
		assertEquals(parse("a[4]"), as.get(0).ref);
		assertEquals(new ConstantExpression(9L), as.get(0).value);
		assertEquals(0, as.get(0).index);
		assertEquals(parse("a.length"), as.get(1).ref);
		assertEquals(parse("Math.max(5, a.length)"), as.get(1).value);
		assertEquals(1, as.get(1).index);
	}

	@Test
	void variableIndexWrite() {
		Automaton a = build(chart("arrays",
				data(new DataDeclaration("m", "int32[3][3]", null),
				     new DataDeclaration("i", "int32", "0")),
				new State("s0", List.of(on("set", null, "s0", new Assign("m[i][2]", "i"))))));
		List<Assignment> as = edge(a, "s0", "set_on_receive").getDestinations().get(0).getAssignments();
		assertEquals(3, as.size());
		assertEquals(parse("Math.max(i + 1, m.d1_len)"), as.get(1).value);
		assertEquals(parse("m.d2_len[i]"), as.get(2).ref);
		assertEquals(parse("Math.max(3, m.d2_len[i])"), as.get(2).value);
	}

	@Test
	void wholeArrayAssignment() {
		Automaton a = build(chart("arrays",
				data(new DataDeclaration("a", "int32[4]", null),
				     new DataDeclaration("b", "int32[4]", "[7]")),
				new State("s0", List.of(
						on("lit", null, "s0", new Assign("a", "[1, 2]")),
						on("copy", null, "s0", new Assign("a", "b"))))));
		List<Assignment> lit = edge(a, "s0", "lit_on_receive").getDestinations().get(0).getAssignments();
		assertEquals(2, lit.size());
		assertEquals("a.d1_len", lit.get(1).getVariable());
		assertEquals(new ConstantExpression(2L), lit.get(1).value);
		assertEquals(0, lit.get(1).index);
		List<Assignment> copy = edge(a, "s0", "copy_on_receive").getDestinations().get(0).getAssignments();
		assertEquals(parse("b.length"), copy.get(1).value);
	}

	@Test
	void assignmentErrors() {
		StateChart undeclared = chart("bad", data(),
				new State("s0", List.of(on("e", null, "s0", new Assign("z", "1")))));
		CompilationException e = assertThrows(ModelException.class, () -> build(undeclared));
		assertEquals("bad", e.getAutomaton());
		assertEquals("s0", e.getState());
		assertTrue(e.getMessage().startsWith("In automaton 'bad' state 's0' transition 'e -> s0'"), e.getMessage());

		StateChart wrongType = chart("bad2", data(new DataDeclaration("f", "bool", "false")),
				new State("s0", List.of(on("e", null, "s0", new Assign("f", "3")))));
		assertThrows(ExpressionTypeException.class, () -> build(wrongType));

		StateChart scalarToArray = chart("bad3", data(new DataDeclaration("a", "int32[3]", null)),
				new State("s0", List.of(on("e", null, "s0", new Assign("a", "1")))));
		assertThrows(ExpressionTypeException.class, () -> build(scalarToArray));
	}

	@Test
	void declarationErrors() {
		assertThrows(ExpressionTypeException.class, () -> build(chart("d1",
				data(new DataDeclaration("a", "int32[3]", "x")), new State("s", List.of()))));
		assertThrows(ExpressionTypeException.class, () -> build(chart("d2",
				data(new DataDeclaration("a", "int32[3]", null, 0, 5)), new State("s", List.of()))));
		assertThrows(ExpressionTypeException.class, () -> build(chart("d3",
				data(new DataDeclaration("n", "int32", "1.5")), new State("s", List.of()))));
		Automaton a = build(chart("d4",
				data(new DataDeclaration("r", "float32", "1"),
				     new DataDeclaration("n", "int8", "2", 0, 10)),
				new State("s", List.of())));
		assertEquals(new ConstantExpression(1.0), a.getVariable("r").initial);
		assertEquals(10, a.getVariable("n").type.maximum.intValue());
	}

	@Test
	void transitionStructureErrors() {
		assertThrows(ModelException.class, () -> build(chart("t1", data(),
				new State("s", List.of(on("e", null, "nowhere"))))));
		assertThrows(ModelException.class, () -> build(chart("t2", data(),
				new State("s", List.of(on("e", null, "s"), on("e", null, "s"))))));
		assertThrows(ModelException.class, () -> build(chart("t3", data(),
				new State("s", List.of(on("e", null, "s"), on(null, null, "s"))))));
	}

	@Test
	void synchronizedEventsBlock() {
		Automaton a = build(chart("server", data(),
				new State("idle", List.of(on("srv_plan_request", null, "busy"))),
				new State("busy", List.of(on("done", null, "idle")))));
		for (Edge e : edgesFrom(a, "busy"))
			assertNotEquals("srv_plan_request_on_receive", e.action);
		edge(a, "idle", "done_on_receive");
	}

	@Test
	void behaviorTreeRootHasNoLoops() {
		Automaton a = build(chart(EventNames.BT_ROOT_PREFIX + "main", data(),
				new State("idle", List.of(on("go", null, "busy"))),
				new State("busy", List.of(on("stop", null, "idle")))));
		assertEquals(2, a.getEdges().size());
	}

	@Test
	void initialEntryActions() {
		State init = new State("start", List.of(new Assign("x", "5")), List.of(), List.of(on("go", null, "start")));
		Automaton a = build(chart("entry", data(new DataDeclaration("x", "int32", "0")), init));
		String first = "start" + AutomatonBuilder.FIRST_EXEC_SUFFIX;
		assertEquals(first, a.getInitialLocation());
		String h = AutomatonBuilder.hash(first, "start", "onentry");
		Edge entry = edge(a, first, first + "-start-parent-" + h);
		assertEquals("start", entry.getDestinations().get(0).getLocation());
		assertEquals(new ConstantExpression(5L), entry.getDestinations().get(0).getAssignments().get(0).value);
		/* The self transition runs the entry actions again. */
		Destination d = edge(a, "start", "go_on_receive").getDestinations().get(0);
		assertEquals(1, d.getAssignments().size());
	}

	@Test
	void exitActionsRunFirst() {
		State s = new State("s", List.of(), List.of(new Assign("x", "1")),
				List.of(on("e", null, "t", new Assign("x", "x * 10"))));
		Automaton a = build(chart("exit", data(new DataDeclaration("x", "int32", "0")),
				s, new State("t", List.of())));
		List<Assignment> as = edge(a, "s", "e_on_receive").getDestinations().get(0).getAssignments();
		assertEquals(2, as.size());
		assertEquals(0, as.get(0).index);
		assertEquals(1, as.get(1).index);
		assertEquals(parse("x * 10"), as.get(1).value);
	}

	@Test
	void invalidArraySize() {
		StateChart c = chart("c", data(), new State("s", List.of()));
		assertThrows(IllegalArgumentException.class, () -> new AutomatonBuilder(c, events, 0));
	}
}
