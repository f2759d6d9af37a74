package nl.utwente.ewi.fmt.SC2JANI.statechart;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import nl.utwente.ewi.fmt.SC2JANI.Assignment;
import nl.utwente.ewi.fmt.SC2JANI.Automaton;
import nl.utwente.ewi.fmt.SC2JANI.CompilationException;
import nl.utwente.ewi.fmt.SC2JANI.Destination;
import nl.utwente.ewi.fmt.SC2JANI.Edge;
import nl.utwente.ewi.fmt.SC2JANI.ExpressionTypeException;
import nl.utwente.ewi.fmt.SC2JANI.JaniModel.JaniBaseType;
import nl.utwente.ewi.fmt.SC2JANI.JaniModel.JaniType;
import nl.utwente.ewi.fmt.SC2JANI.JaniModel.JaniVariable;
import nl.utwente.ewi.fmt.SC2JANI.JaniUtils;
import nl.utwente.ewi.fmt.SC2JANI.ModelException;
import nl.utwente.ewi.fmt.SC2JANI.expression.ArrayInfo;
import nl.utwente.ewi.fmt.SC2JANI.expression.ArrayValueExpression;
import nl.utwente.ewi.fmt.SC2JANI.expression.ConstantExpression;
import nl.utwente.ewi.fmt.SC2JANI.expression.DistributionExpression;
import nl.utwente.ewi.fmt.SC2JANI.expression.Expression;
import nl.utwente.ewi.fmt.SC2JANI.expression.ExpressionParser;
import nl.utwente.ewi.fmt.SC2JANI.expression.Operator;
import nl.utwente.ewi.fmt.SC2JANI.expression.OperatorExpression;
import nl.utwente.ewi.fmt.SC2JANI.expression.VariableExpression;

/**
 * Compiles one state chart into an automaton.
 *
 * Every transition becomes an edge with one destination per target.
 * Executable content that cannot be done in a single step (sending
 * an event, conditionals) splits the path from the source to the
 * target state into several edges through intermediate locations.
 * States that do not handle an event received elsewhere in the
 * chart get self-loops on it, so that the event is never blocked.
 */
public class AutomatonBuilder
{
	private static final Logger log = LoggerFactory.getLogger(AutomatonBuilder.class);

	/** Tolerance on the sum of the probabilities of a transition. */
	public static final double EPSILON = 1e-5;
	public static final String FIRST_EXEC_SUFFIX = "-first-exec";
	public static final String BEFORE_IF_SUFFIX = "_before_if";
	public static final String AFTER_IF_SUFFIX = "_after_if";
	/* Key for transitions without event in the per-state tables. */
	private static final String EVENTLESS = "";

	private final StateChart chart;
	private final EventRegistry events;
	private final int maxArraySize;
	private final Automaton automaton;
	private final HashMap<String, JaniType> types = new HashMap<>();
	private final HashMap<String, JaniType> globals = new HashMap<>();
	/* Per state, the events handled without condition. */
	private final LinkedHashMap<String, Set<String>> unconditional = new LinkedHashMap<>();
	/* Per state and event, the conditions of the transitions. */
	private final LinkedHashMap<String, Map<String, List<Expression>>> conditions = new LinkedHashMap<>();
	private String currentState;
	private Transition currentTransition;

	/** A path of edges from a source to a target location, with
	 * the counter for naming its intermediate locations. */
	private static class Path
	{
		final String source, target, hash, event;
		int counter;

		Path(String source, String target, String hash, String event) {
			this.source = source;
			this.target = target;
			this.hash = hash;
			this.event = event;
		}

		String nextLocation() {
			return source + "-" + hash + "-" + counter++;
		}
	}

	/**
	 * @param events Registry receiving the senders, receivers and
	 * data fields of the events the chart uses.
	 * @param maxArraySize Capacity of arrays declared without size.
	 */
	public AutomatonBuilder(StateChart chart, EventRegistry events, int maxArraySize)
	{
		if (maxArraySize < 1)
			throw new IllegalArgumentException("Maximum array size should be positive, not " + maxArraySize);
		this.chart = chart;
		this.events = events;
		this.maxArraySize = maxArraySize;
		this.automaton = new Automaton(chart.name);
	}

	public static Automaton build(StateChart chart, EventRegistry events, int maxArraySize) {
		return new AutomatonBuilder(chart, events, maxArraySize).build();
	}

	/** Make the type of a model-level constant or variable known,
	 * for inferring the types of event data. */
	public void declareGlobal(String name, JaniType type) {
		globals.put(name, type);
	}

	public Automaton build()
	{
		log.debug("Compiling state chart {}", chart.name);
		try {
			declareData();
			for (State s : chart.getStates()) {
				currentState = s.id;
				compileState(s);
				currentTransition = null;
			}
			currentState = null;
			addSelfLoops();
			currentState = chart.initial;
			addEntry();
		} catch (CompilationException e) {
			throw e.addContext(chart.name, currentState,
					currentTransition == null ? null : currentTransition.toString());
		}
		log.debug("Compiled {}", automaton);
		return automaton;
	}

	/** The first 8 hexadecimal digits of the SHA-256 hash of the
	 * parts, joined by slashes. */
	public static String hash(String... parts) {
		MessageDigest md;
		try {
			md = MessageDigest.getInstance("SHA-256");
		} catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("SHA-256 is not available", e);
		}
		byte[] digest = md.digest(String.join("/", parts).getBytes(StandardCharsets.UTF_8));
		StringBuilder ret = new StringBuilder();
		for (int i = 0; i < 4; i++)
			ret.append(String.format("%02x", digest[i] & 0xff));
		return ret.toString();
	}

	/**
	 * Guard of a transition that may only be taken if none of the
	 * previous transitions on the same event is enabled:
	 * cond ∧ ¬p1 ∧ ¬p2 ∧ …
	 *
	 * @param cond The own condition, or null if unconditional.
	 * @return The guard, or null if there is nothing to check.
	 */
	public static Expression merge(List<Expression> previous, Expression cond) {
		Expression ret = cond;
		for (Expression p : previous) {
			Expression not = new OperatorExpression(Operator.NOT, p);
			ret = ret == null ? not : new OperatorExpression(Operator.AND, ret, not);
		}
		return ret;
	}

	private void declareData() {
		for (DataDeclaration d : chart.datamodel) {
			JaniType type = JaniUtils.parseType(d.type, maxArraySize);
			if (d.lower != null || d.upper != null) {
				if (type.isArray())
					throw new ExpressionTypeException("Array " + d.id + " cannot be bounded");
				type = type.withBounds(d.lower, d.upper);
			}
			Expression init = null;
			ArrayValueExpression literal = null;
			if (d.expr != null) {
				ExpressionParser parser = new ExpressionParser(d.expr, type.shape());
				init = parser.parse();
				literal = parser.getUnpaddedLiteral();
				if (type.isArray() && literal == null)
					throw new ExpressionTypeException("Array " + d.id + " should be initialized with a literal, not " + d.expr);
				if (!type.isArray())
					init = checkScalar(d.id, type, init);
			}
			declare(new JaniVariable(type, d.id, init));
			if (type.isArray()) {
				ArrayInfo shape = type.shape();
				for (int k = 1; k <= type.dimensions(); k++) {
					ArrayInfo lengths = shape.lengthShape(k);
					JaniType lt = lengths == null
					              ? new JaniType(JaniBaseType.INTEGER)
					              : new JaniType(JaniBaseType.INTEGER, lengths.maxSizes);
					declare(new JaniVariable(lt, ExpressionParser.lengthVariable(d.id, k),
					                         shape.lengthValue(k, literal)));
				}
			}
		}
	}

	private void declare(JaniVariable v) {
		automaton.addVariable(v);
		types.put(v.name, v.type);
	}

	/* Check a literal assigned to a scalar, converting integers
	 * assigned to reals. */
	private static Expression checkScalar(String var, JaniType type, Expression value) {
		if (value instanceof ArrayValueExpression)
			throw new ExpressionTypeException("Cannot assign array " + value + " to scalar " + var);
		if (!(value instanceof ConstantExpression))
			return value;
		ConstantExpression c = (ConstantExpression)value;
		switch (type.base) {
		case BOOLEAN:
			if (!c.isBoolean())
				throw new ExpressionTypeException("Cannot assign " + c + " to boolean " + var);
			return c;
		case INTEGER:
			if (!c.isInteger())
				throw new ExpressionTypeException("Cannot assign " + c + " to integer " + var);
			return c;
		case REAL:
			if (c.isBoolean())
				throw new ExpressionTypeException("Cannot assign " + c + " to real " + var);
			if (c.isInteger())
				return new ConstantExpression(c.numberValue().doubleValue());
			return c;
		}
		throw new AssertionError("Unknown base type " + type.base);
	}

	private void compileState(State s) {
		automaton.addLocation(s.id);
		Set<String> uncond = new LinkedHashSet<>();
		Map<String, List<Expression>> conds = new LinkedHashMap<>();
		unconditional.put(s.id, uncond);
		conditions.put(s.id, conds);
		boolean hasEvents = false, eventlessUncond = false;
		for (Transition t : s.transitions) {
			hasEvents |= t.event != null;
			eventlessUncond |= t.event == null && t.cond == null;
		}
		if (hasEvents && eventlessUncond)
			throw new ModelException("State " + s.id + " has an unconditional transition without event, making its event transitions unreachable");
		for (Transition t : s.transitions) {
			currentTransition = t;
			compileTransition(s, t, uncond, conds);
		}
	}

	private void compileTransition(State s, Transition t,
	                               Set<String> uncond,
	                               Map<String, List<Expression>> conds)
	{
		for (Transition.Target target : t.targets) {
			if (chart.getState(target.id) == null)
				throw new ModelException("Unknown target state " + target.id);
		}
		String key = t.event == null ? EVENTLESS : t.event;
		if (t.cond == null && !uncond.add(key))
			throw new ModelException("Second unconditional transition on " + (t.event == null ? "no event" : "event " + t.event));

		String action;
		if (t.event != null) {
			Event ev = events.getOrCreate(t.event);
			action = ev.receiveAction();
			ev.addReceiver(chart.name, action);
		} else {
			action = "transition-" + s.id + "-eventless-" + hash(s.id, String.valueOf(t.cond));
		}

		List<Expression> previous = conds.computeIfAbsent(key, k -> new ArrayList<>());
		Expression cond = null;
		if (t.cond != null)
			cond = ExpressionParser.parse(t.cond).replaceEvent(t.event);
		Expression guard = merge(previous, cond);
		if (cond != null)
			previous.add(cond);

		double[] probs = probabilities(t);
		Edge edge = new Edge(s.id, action, guard);
		ArrayList<Edge> edges = new ArrayList<>();
		ArrayList<String> locations = new ArrayList<>();
		double total = 0;
		for (int i = 0; i < t.targets.size(); i++) {
			Transition.Target target = t.targets.get(i);
			Expression p = null;
			if (t.targets.size() > 1)
				p = new ConstantExpression(probs[i]);
			Destination d = new Destination(null, p);
			edge.addDestination(d);
			total += probs[i];
			String h = hash(s.id, target.id, action, String.valueOf(t.cond), Double.toString(total));
			ArrayList<ExecutableEntry> body = new ArrayList<>(s.onExit);
			body.addAll(target.body);
			body.addAll(chart.getState(target.id).onEntry);
			BodyCursor cursor = walk(BodyCursor.start(d), body,
					new Path(s.id, target.id, h, t.event));
			cursor.open.setLocation(target.id);
			edges.addAll(cursor.edges);
			locations.addAll(cursor.locations);
		}
		automaton.addEdge(edge);
		automaton.addEdges(edges);
		for (String l : locations)
			automaton.addLocation(l);
	}

	private static double[] probabilities(Transition t) {
		double[] ret = new double[t.targets.size()];
		double total = 0;
		for (int i = 0; i < ret.length; i++) {
			Transition.Target target = t.targets.get(i);
			double p = target.probability == null ? 1 - total : target.probability;
			if (!(p > 0))
				throw new ModelException("Probability " + p + " of target " + target.id + " should be positive");
			ret[i] = p;
			total += p;
		}
		if (Math.abs(1 - total) > EPSILON)
			throw new ModelException("Probabilities sum to " + total + " instead of 1");
		return ret;
	}

	private BodyCursor walk(BodyCursor cursor, List<ExecutableEntry> body, Path path) {
		for (ExecutableEntry entry : body) {
			switch (entry.getKind()) {
			case ASSIGN:
				assign(cursor.open, (Assign)entry, path.event);
				break;
			case SEND:
				cursor = send(cursor, (Send)entry, path);
				break;
			case IF:
				cursor = conditional(cursor, (If)entry, path);
				break;
			}
		}
		return cursor;
	}

	private void assign(Destination d, Assign a, String event) {
		Expression ref = ExpressionParser.parse(a.location).replaceEvent(event);
		ArrayList<Expression> indices = new ArrayList<>();
		String var = root(ref, indices);
		if (var == null)
			throw new ExpressionTypeException("Cannot assign to " + a.location);
		JaniType type = types.get(var);
		if (type == null)
			throw new ModelException("Assignment to undeclared variable " + var);
		if (indices.size() > type.dimensions())
			throw new ExpressionTypeException("Too many indices for " + type + " " + var + " in " + a.location);
		ArrayInfo shape = null;
		if (indices.size() < type.dimensions())
			shape = new ArrayInfo(type.base, type.sizes.subList(indices.size(), type.dimensions()));
		ExpressionParser parser = new ExpressionParser(a.expr, shape);
		Expression value = parser.parse().replaceEvent(event);
		int index = d.nextIndex();
		if (shape == null) {
			value = checkScalar(a.location, new JaniType(type.base), value);
			d.addAssignment(new Assignment(ref, value, index));
		} else {
			d.addAssignment(new Assignment(ref, value, index));
			d.addAssignments(lengthAssignments(var, indices, shape,
					value, parser.getUnpaddedLiteral(), index));
		}
		/* Writing an element may extend the array. */
		for (int level = 1; level <= indices.size(); level++) {
			List<Expression> prefix = indices.subList(0, level - 1);
			Expression len = lengthRef(var, level, prefix);
			Expression next = increment(indices.get(level - 1));
			d.addAssignment(new Assignment(len,
					new OperatorExpression(Operator.MAX, next, len),
					index + 1));
		}
	}

	/* The variable at the root of an access chain, collecting the
	 * indices outermost first; null if not a variable. */
	private static String root(Expression e, List<Expression> indices) {
		while (e instanceof OperatorExpression
		       && ((OperatorExpression)e).op == Operator.ARRAY_ACCESS)
		{
			OperatorExpression aa = (OperatorExpression)e;
			indices.add(0, aa.getOperand("index"));
			e = aa.getOperand("exp");
		}
		if (e instanceof VariableExpression)
			return ((VariableExpression)e).variable;
		return null;
	}

	private static Expression increment(Expression index) {
		if (index instanceof ConstantExpression && ((ConstantExpression)index).isInteger())
			return new ConstantExpression(((ConstantExpression)index).numberValue().longValue() + 1);
		return new OperatorExpression(Operator.ADD, index, new ConstantExpression(1L));
	}

	/* The length of dimension dim of the (sub)array selected by the
	 * indices; an array of lengths if there are fewer than dim-1. */
	private static Expression lengthRef(String var, int dim, List<Expression> indices) {
		Expression ret = new VariableExpression(ExpressionParser.lengthVariable(var, dim));
		for (int i = 0; i < Math.min(dim - 1, indices.size()); i++)
			ret = new OperatorExpression(Operator.ARRAY_ACCESS, ret, indices.get(i));
		return ret;
	}

	/**
	 * Assignments keeping the lengths of the (sub)array of var at
	 * the given indices in line with the assigned value.
	 */
	private List<Assignment> lengthAssignments(String var, List<Expression> indices,
	                                           ArrayInfo shape, Expression value,
	                                           ArrayValueExpression literal, int index)
	{
		ArrayList<Assignment> ret = new ArrayList<>();
		ArrayList<Expression> srcIndices = new ArrayList<>();
		String src = null;
		if (literal == null) {
			src = root(value, srcIndices);
			if (src == null)
				throw new ExpressionTypeException("Cannot assign " + value + " to an array of type " + shape);
			JaniType srcType = variableType(src);
			if (srcType != null && srcType.dimensions() - srcIndices.size() != shape.dimensions())
				throw new ExpressionTypeException("Cannot assign " + value + " of type " + srcType + " to an array of type " + shape);
		}
		int depth = indices.size();
		for (int k = 1; k <= shape.dimensions(); k++) {
			Expression target = lengthRef(var, depth + k, indices);
			Expression len;
			if (literal != null)
				len = shape.lengthValue(k, literal);
			else
				len = lengthRef(src, srcIndices.size() + k, srcIndices);
			ret.add(new Assignment(target, len, index));
		}
		return ret;
	}

	private BodyCursor send(BodyCursor cursor, Send s, Path path) {
		Event ev = events.getOrCreate(s.event);
		String interm = path.nextLocation();
		cursor.open.setLocation(interm);
		Edge edge = new Edge(interm, ev.sendAction());
		Destination d = new Destination(null);
		edge.addDestination(d);
		LinkedHashMap<String, JaniType> structure = new LinkedHashMap<>();
		for (Send.Param p : s.params) {
			String field = ev.fieldVariable(p.name);
			ExpressionParser parser = new ExpressionParser(p.expr, null);
			Expression value = parser.parse().replaceEvent(path.event);
			ArrayValueExpression literal = parser.getUnpaddedLiteral();
			JaniType type;
			if (literal != null) {
				ArrayList<Integer> sizes = new ArrayList<>();
				for (Expression e = literal; e instanceof ArrayValueExpression;
				     e = ((ArrayValueExpression)e).elements.isEmpty() ? null : ((ArrayValueExpression)e).elements.get(0))
				{
					sizes.add(maxArraySize);
				}
				type = new JaniType(literalBase(literal), sizes);
				parser = new ExpressionParser(p.expr, type.shape());
				value = parser.parse();
			} else {
				type = inferType(value);
			}
			if (type == null)
				type = ev.getDataStructure().get(p.name);
			if (type == null)
				throw new ExpressionTypeException("Cannot determine the type of parameter " + p.name + " = " + p.expr + " of event " + ev.name);
			structure.put(p.name, type);
			d.addAssignment(new Assignment(field, value, 0));
			if (type.isArray())
				d.addAssignments(lengthAssignments(field, List.of(), type.shape(), value, literal, 0));
		}
		d.addAssignment(new Assignment(ev.fieldVariable(Event.VALID_FIELD), ConstantExpression.TRUE, 0));
		ev.setDataStructure(structure);
		ev.addSender(chart.name, ev.sendAction());
		return cursor.then(edge, d, interm);
	}

	private static JaniBaseType literalBase(Expression e) {
		if (e instanceof ArrayValueExpression) {
			for (Expression el : ((ArrayValueExpression)e).elements) {
				if (literalBase(el) == JaniBaseType.REAL)
					return JaniBaseType.REAL;
			}
			return JaniBaseType.INTEGER;
		}
		return ((ConstantExpression)e).isReal() ? JaniBaseType.REAL : JaniBaseType.INTEGER;
	}

	/** The type of an expression sent as event data, or null if it
	 * cannot be determined here. */
	JaniType inferType(Expression e) {
		if (e instanceof ConstantExpression) {
			ConstantExpression c = (ConstantExpression)e;
			if (c.isBoolean())
				return new JaniType(JaniBaseType.BOOLEAN);
			return new JaniType(c.isInteger() ? JaniBaseType.INTEGER : JaniBaseType.REAL);
		}
		if (e instanceof VariableExpression) {
			JaniType t = variableType(((VariableExpression)e).variable);
			return t == null ? null : new JaniType(t.base, t.sizes);
		}
		if (e instanceof DistributionExpression)
			return new JaniType(JaniBaseType.REAL);
		if (!(e instanceof OperatorExpression))
			return null;
		OperatorExpression o = (OperatorExpression)e;
		if (o.op.returnsBoolean)
			return new JaniType(JaniBaseType.BOOLEAN);
		switch (o.op) {
		case ARRAY_ACCESS:
			JaniType array = inferType(o.getOperand("exp"));
			if (array == null || !array.isArray())
				return null;
			return new JaniType(array.base, array.sizes.subList(1, array.sizes.size()));
		case ITE:
			return inferType(o.getOperand("then"));
		case DIVIDE:
		case POW:
		case LOG:
		case SIN:
		case COS:
			return new JaniType(JaniBaseType.REAL);
		case FLOOR:
		case CEIL:
		case ROUND:
			return new JaniType(JaniBaseType.INTEGER);
		default:
			break;
		}
		if (o.op.macro)
			return new JaniType(JaniBaseType.REAL);
		JaniBaseType base = JaniBaseType.INTEGER;
		for (Expression child : o.getChildren()) {
			JaniType t = inferType(child);
			if (t == null)
				return null;
			if (t.base == JaniBaseType.REAL)
				base = JaniBaseType.REAL;
		}
		return new JaniType(base);
	}

	private JaniType variableType(String name) {
		JaniType ret = types.get(name);
		if (ret == null)
			ret = globals.get(name);
		if (ret != null)
			return ret;
		for (Event ev : events.getEvents()) {
			String prefix = ev.name + ".";
			if (name.startsWith(prefix)) {
				ret = ev.getDataStructure().get(name.substring(prefix.length()));
				if (ret != null)
					return ret;
			}
		}
		return null;
	}

	private BodyCursor conditional(BodyCursor cursor, If stmt, Path path) {
		String base = path.nextLocation();
		String before = base + BEFORE_IF_SUFFIX;
		String after = base + AFTER_IF_SUFFIX;
		cursor.open.setLocation(before);

		ArrayList<Expression> conds = new ArrayList<>();
		ArrayList<String> hashParts = new ArrayList<>();
		hashParts.add(before);
		for (If.Branch b : stmt.branches) {
			conds.add(ExpressionParser.parse(b.cond).replaceEvent(path.event));
			hashParts.add(b.cond);
		}
		String ifHash = hash(hashParts.toArray(new String[0]));

		for (int i = 0; i <= conds.size(); i++) {
			boolean isElse = i == conds.size();
			String branchHash = path.hash + "-" + ifHash + "-" + i;
			Expression guard = isElse ? merge(conds, null)
			                          : merge(conds.subList(0, i), conds.get(i));
			Edge edge = new Edge(before, before + "-" + after + "-parent-" + branchHash, guard);
			Destination d = new Destination(null);
			edge.addDestination(d);
			List<ExecutableEntry> body = isElse ? stmt.elseBody : stmt.branches.get(i).body;
			BodyCursor branch = walk(BodyCursor.start(edge, d), body,
					new Path(before, after, branchHash, path.event));
			branch.open.setLocation(after);
			cursor = cursor.include(branch);
		}

		Edge resume = new Edge(after, path.source + "-" + path.target + "-" + path.hash);
		Destination d = new Destination(null);
		resume.addDestination(d);
		return cursor.then(resume, d, before, after);
	}

	private void addSelfLoops() {
		if (EventNames.isBtRoot(chart.name))
			return;
		TreeSet<String> handled = new TreeSet<>();
		for (String s : unconditional.keySet()) {
			handled.addAll(unconditional.get(s));
			handled.addAll(conditions.get(s).keySet());
		}
		handled.remove(EVENTLESS);
		for (String s : unconditional.keySet()) {
			Set<String> uncond = unconditional.get(s);
			if (uncond.contains(EVENTLESS))
				continue;
			currentState = s;
			for (String event : handled) {
				if (uncond.contains(event))
					continue;
				List<Expression> conds = conditions.get(s).getOrDefault(event, List.of());
				if (conds.isEmpty() && EventNames.isSynchronized(event))
					continue;
				Event ev = events.getOrCreate(event);
				Edge loop = new Edge(s, ev.receiveAction(), merge(conds, null));
				loop.addDestination(new Destination(s));
				automaton.addEdge(loop);
				ev.addReceiver(chart.name, ev.receiveAction());
				log.debug("Self-loop on {} in state {} of {}", event, s, chart.name);
			}
		}
	}

	private void addEntry() {
		State init = chart.getState(chart.initial);
		if (init.onEntry.isEmpty()) {
			automaton.setInitialLocation(init.id);
			return;
		}
		String first = init.id + FIRST_EXEC_SUFFIX;
		String h = hash(first, init.id, "onentry");
		Edge edge = new Edge(first, first + "-" + init.id + "-parent-" + h);
		Destination d = new Destination(null);
		edge.addDestination(d);
		BodyCursor cursor = walk(BodyCursor.start(edge, d), init.onEntry,
				new Path(first, init.id, h, null));
		cursor.open.setLocation(init.id);
		automaton.setInitialLocation(first);
		automaton.addEdges(cursor.edges);
		for (String l : cursor.locations)
			automaton.addLocation(l);
	}
}
