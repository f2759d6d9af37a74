package nl.utwente.ewi.fmt.SC2JANI.statechart;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import nl.ennoruijters.util.JSONParser;

/**
 * Reads state charts from their JSON form. Expressions stay in their
 * textual form; they are parsed while building the automaton.
 */
public class StateChartReader
{
	private StateChartReader() { }

	public static StateChart read(String filename) throws IOException {
		return fromJson(JSONParser.readJsonFromFile(filename));
	}

	public static StateChart fromJson(Object json) {
		Map<?, ?> root = object(json, "State chart");
		String name = string(root, "name", true);
		String initial = string(root, "initial", false);
		ArrayList<DataDeclaration> data = new ArrayList<>();
		for (Object o : array(root.get("datamodel"), "datamodel"))
			data.add(dataDeclaration(object(o, "Data declaration")));
		ArrayList<State> states = new ArrayList<>();
		for (Object o : array(root.get("states"), "states"))
			states.add(state(object(o, "State")));
		return new StateChart(name, initial, data, states);
	}

	private static DataDeclaration dataDeclaration(Map<?, ?> d) {
		return new DataDeclaration(string(d, "id", true),
		                           string(d, "type", true),
		                           expression(d, "expr"),
		                           number(d, "lower"),
		                           number(d, "upper"));
	}

	private static State state(Map<?, ?> s) {
		String id = string(s, "id", true);
		ArrayList<Transition> transitions = new ArrayList<>();
		for (Object o : array(s.get("transitions"), "transitions of state " + id))
			transitions.add(transition(object(o, "Transition")));
		return new State(id, body(s.get("onentry")),
		                 body(s.get("onexit")), transitions);
	}

	private static Transition transition(Map<?, ?> t) {
		String event = string(t, "event", false);
		String cond = expression(t, "cond");
		ArrayList<Transition.Target> targets = new ArrayList<>();
		Object targetsO = t.get("targets");
		if (targetsO != null) {
			if (t.containsKey("target"))
				throw new IllegalArgumentException("Transition with both 'target' and 'targets': " + t);
			for (Object o : array(targetsO, "targets")) {
				Map<?, ?> target = object(o, "Transition target");
				Number p = number(target, "prob");
				targets.add(new Transition.Target(string(target, "id", true),
						p == null ? null : p.doubleValue(),
						body(target.get("body"))));
			}
		} else {
			targets.add(new Transition.Target(string(t, "target", true),
			                                  body(t.get("body"))));
		}
		return new Transition(event, cond, targets);
	}

	static List<ExecutableEntry> body(Object json) {
		ArrayList<ExecutableEntry> ret = new ArrayList<>();
		for (Object o : array(json, "executable content"))
			ret.add(entry(object(o, "Executable content")));
		return ret;
	}

	private static ExecutableEntry entry(Map<?, ?> e) {
		if (e.size() != 1)
			throw new IllegalArgumentException("Executable content should have exactly one kind: " + e.keySet());
		Object kind = e.keySet().iterator().next();
		Map<?, ?> c = object(e.get(kind), kind.toString());
		switch (kind.toString()) {
		case "assign":
			return new Assign(string(c, "location", true), expression(c, "expr"));
		case "send":
			ArrayList<Send.Param> params = new ArrayList<>();
			for (Object o : array(c.get("params"), "params")) {
				Map<?, ?> p = object(o, "Send parameter");
				params.add(new Send.Param(string(p, "name", true),
				                          expression(p, "expr")));
			}
			return new Send(string(c, "event", true), params);
		case "if":
			ArrayList<If.Branch> branches = new ArrayList<>();
			for (Object o : array(c.get("branches"), "branches")) {
				Map<?, ?> b = object(o, "Conditional branch");
				branches.add(new If.Branch(expression(b, "cond"),
				                           body(b.get("body"))));
			}
			return new If(branches, body(c.get("else")));
		default:
			throw new IllegalArgumentException("Unknown executable content: " + kind);
		}
	}

	private static Map<?, ?> object(Object o, String what) {
		if (!(o instanceof Map))
			throw new IllegalArgumentException(what + " should be an object, not: " + o);
		return (Map<?, ?>)o;
	}

	private static Object[] array(Object o, String what) {
		if (o == null)
			return new Object[0];
		if (!(o instanceof Object[]))
			throw new IllegalArgumentException("Expected array for " + what + ", found: " + o);
		return (Object[])o;
	}

	private static String string(Map<?, ?> m, String key, boolean required) {
		Object o = m.get(key);
		if (o == null) {
			if (required)
				throw new IllegalArgumentException("Missing '" + key + "' in " + m);
			return null;
		}
		if (!(o instanceof String))
			throw new IllegalArgumentException("'" + key + "' should be a string, not: " + o);
		return (String)o;
	}

	/* Expressions may be given as JSON literals for convenience. */
	private static String expression(Map<?, ?> m, String key) {
		Object o = m.get(key);
		if (o == null)
			return null;
		if (o instanceof String)
			return (String)o;
		if (o instanceof Number || o instanceof Boolean)
			return o.toString();
		throw new IllegalArgumentException("'" + key + "' should be an expression, not: " + o);
	}

	private static Number number(Map<?, ?> m, String key) {
		Object o = m.get(key);
		if (o == null)
			return null;
		if (!(o instanceof Number))
			throw new IllegalArgumentException("'" + key + "' should be a number, not: " + o);
		return (Number)o;
	}
}
