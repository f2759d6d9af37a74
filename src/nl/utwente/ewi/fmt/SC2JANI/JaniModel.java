package nl.utwente.ewi.fmt.SC2JANI;

import java.io.PrintStream;
import java.util.*;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import nl.utwente.ewi.fmt.SC2JANI.expression.ArrayComparisonLowering;
import nl.utwente.ewi.fmt.SC2JANI.expression.ArrayInfo;
import nl.utwente.ewi.fmt.SC2JANI.expression.ConstantExpression;
import nl.utwente.ewi.fmt.SC2JANI.expression.Expression;
import nl.utwente.ewi.fmt.SC2JANI.expression.MacroExpansion;
import nl.utwente.ewi.fmt.SC2JANI.expression.Operator;

/**
 * A network of automata with its global variables, constants,
 * composition and properties, as written to a JANI file.
 */
public class JaniModel
{
	private static final Logger log = LoggerFactory.getLogger(JaniModel.class);

	public enum JaniBaseType {
		BOOLEAN("bool"),
		INTEGER("int"),
		REAL("real");

		public final String janiName;

		JaniBaseType(String janiName) {
			this.janiName = janiName;
		}

		public Expression defaultValue() {
			switch (this) {
			case BOOLEAN: return ConstantExpression.FALSE;
			case INTEGER: return ConstantExpression.ZERO;
			default: return new ConstantExpression(0.0);
			}
		}
	}

	public static class JaniType {
		public final JaniBaseType base;
		/** Inclusive bounds, or null if unbounded. */
		public final Number minimum;
		public final Number maximum;
		/** Maximum size of each array dimension; empty for scalars. */
		public final List<Integer> sizes;

		public JaniType(JaniBaseType base, Number min, Number max,
		                List<Integer> sizes)
		{
			if (base == JaniBaseType.BOOLEAN && (min != null || max != null))
				throw new ExpressionTypeException("Booleans cannot be bounded");
			if (min != null && max != null && min.doubleValue() > max.doubleValue())
				throw new ExpressionTypeException("Empty range [" + min + ", " + max + "]");
			if (base == JaniBaseType.BOOLEAN && !sizes.isEmpty())
				throw new ExpressionTypeException("Arrays of booleans are not supported");
			this.base = base;
			this.minimum = min;
			this.maximum = max;
			this.sizes = List.copyOf(sizes);
		}

		public JaniType(JaniBaseType base, Number min, Number max)
		{
			this(base, min, max, List.of());
		}

		public JaniType(JaniBaseType base, List<Integer> sizes)
		{
			this(base, null, null, sizes);
		}

		public JaniType(JaniBaseType base)
		{
			this(base, null, null, List.of());
		}

		public boolean isArray() {
			return !sizes.isEmpty();
		}

		public int dimensions() {
			return sizes.size();
		}

		/** The shape of this array type, or null for scalars. */
		public ArrayInfo shape() {
			return isArray() ? new ArrayInfo(base, sizes) : null;
		}

		public JaniType withBounds(Number min, Number max) {
			return new JaniType(base, min, max, sizes);
		}

		/** Initial value of variables of this type without an
		 * explicit initializer. */
		public Expression defaultValue() {
			if (isArray())
				return shape().defaultValue();
			return base.defaultValue();
		}

		public void writeJani(PrintStream out) {
			writeJani(out, 0);
		}

		private void writeJani(PrintStream out, int dim) {
			if (dim < sizes.size()) {
				out.print("{\"kind\": \"array\", \"base\": ");
				writeJani(out, dim + 1);
				out.print("}");
			} else if (minimum != null || maximum != null) {
				out.print("{\"kind\": \"bounded\", \"base\": \"" + base.janiName + "\"");
				if (minimum != null)
					out.print(", \"lower-bound\": " + minimum);
				if (maximum != null)
					out.print(", \"upper-bound\": " + maximum);
				out.print("}");
			} else {
				out.print("\"" + base.janiName + "\"");
			}
		}

		public boolean equals(Object other) {
			if (!(other instanceof JaniType))
				return false;
			JaniType o = (JaniType)other;
			return base == o.base && Objects.equals(minimum, o.minimum)
			       && Objects.equals(maximum, o.maximum)
			       && sizes.equals(o.sizes);
		}

		public int hashCode() {
			return Objects.hash(base, minimum, maximum, sizes);
		}

		public String toString() {
			StringBuilder ret = new StringBuilder(base.janiName);
			if (minimum != null || maximum != null)
				ret.append('[').append(minimum).append("..").append(maximum).append(']');
			for (Integer s : sizes)
				ret.append('[').append(s).append(']');
			return ret.toString();
		}
	}

	public static class JaniVariable {
		public final JaniType type;
		public final String name;
		public final Expression initial;
		public final boolean isTransient;

		public JaniVariable(JaniType type, String name,
		                    Expression initial, boolean isTransient)
		{
			if (name == null || name.isEmpty())
				throw new IllegalArgumentException("Variable without name");
			this.type = type;
			this.name = name;
			this.initial = initial == null ? type.defaultValue() : initial;
			this.isTransient = isTransient;
			if (!isTransient && type.base == JaniBaseType.REAL)
				log.debug("Variable {} is a non-transient real, which not all model checkers support", name);
		}

		public JaniVariable(JaniType type, String name, Expression initial)
		{
			this(type, name, initial, false);
		}

		public void printJani(PrintStream out, int indent, JaniModel model) {
			out.print(JaniUtils.tabs(indent) + "{\"name\": " + JaniUtils.quote(name) + ", \"type\": ");
			type.writeJani(out);
			out.print(", \"transient\": " + isTransient + ", \"initial-value\": ");
			model.finish(initial).writeJani(out, indent + 1);
			out.print("}");
		}
	}

	public static class JaniConstant {
		public final JaniType type;
		public final String name;
		public final Expression value;

		public JaniConstant(JaniType type, String name, Expression value)
		{
			if (type.isArray())
				throw new ExpressionTypeException("Constant " + name + " cannot be an array");
			if (value == null)
				throw new ModelException("Constant " + name + " has no value");
			this.type = type;
			this.name = name;
			this.value = value;
		}

		public void printJani(PrintStream out, int indent, JaniModel model) {
			out.print(JaniUtils.tabs(indent) + "{\"name\": " + JaniUtils.quote(name) + ", \"type\": ");
			type.writeJani(out);
			out.print(", \"value\": ");
			model.finish(value).writeJani(out, indent + 1);
			out.print("}");
		}
	}

	public final String name;
	private String description = "";
	private final LinkedHashMap<String, JaniVariable> globalVars = new LinkedHashMap<>();
	private final LinkedHashMap<String, JaniConstant> constants = new LinkedHashMap<>();
	private final LinkedHashMap<String, Automaton> automata = new LinkedHashMap<>();
	private final ArrayList<Property> properties = new ArrayList<>();
	private Composition composition;
	private Map<String, Expression> constantValues;

	public JaniModel(String name)
	{
		this.name = name;
	}

	public void setDescription(String description) {
		this.description = description == null ? "" : description;
	}

	public void addVariable(JaniVariable v) {
		if (globalVars.putIfAbsent(v.name, v) != null)
			throw new ModelException("Duplicate global variable " + v.name);
	}

	public JaniVariable getVariable(String name) {
		return globalVars.get(name);
	}

	public Collection<JaniVariable> getVariables() {
		return Collections.unmodifiableCollection(globalVars.values());
	}

	public void addConstant(JaniConstant c) {
		if (constants.putIfAbsent(c.name, c) != null)
			throw new ModelException("Duplicate constant " + c.name);
		constantValues = null;
	}

	public JaniConstant getConstant(String name) {
		return constants.get(name);
	}

	public Collection<JaniConstant> getConstants() {
		return Collections.unmodifiableCollection(constants.values());
	}

	/** The value expression of each constant, by name. */
	public Map<String, Expression> getConstantValues() {
		if (constantValues == null) {
			TreeMap<String, Expression> ret = new TreeMap<>();
			for (JaniConstant c : constants.values())
				ret.put(c.name, c.value);
			constantValues = Collections.unmodifiableMap(ret);
		}
		return constantValues;
	}

	public void addAutomaton(Automaton a) {
		if (automata.putIfAbsent(a.name, a) != null)
			throw new ModelException("Duplicate automaton " + a.name);
	}

	public Automaton getAutomaton(String name) {
		return automata.get(name);
	}

	public Collection<Automaton> getAutomata() {
		return Collections.unmodifiableCollection(automata.values());
	}

	public void addProperty(Property p) {
		properties.add(p);
	}

	public List<Property> getProperties() {
		return Collections.unmodifiableList(properties);
	}

	public Composition getComposition() {
		return composition;
	}

	/**
	 * Set the composition of the automata. It should contain
	 * exactly one element per automaton. Every action of an
	 * automaton that does not occur in any of its synchronization
	 * vectors gets a vector of its own.
	 */
	public void setComposition(Composition comp) {
		HashSet<String> seen = new HashSet<>();
		for (String e : comp.getElements()) {
			if (!automata.containsKey(e))
				throw new ModelException("Composition contains unknown automaton " + e);
			if (!seen.add(e))
				throw new ModelException("Automaton " + e + " occurs more than once in the composition");
		}
		for (String a : automata.keySet()) {
			if (!seen.contains(a))
				throw new ModelException("Automaton " + a + " is missing from the composition");
		}
		composition = comp;
		completeComposition();
	}

	/** Add identity synchronization vectors for all actions not
	 * yet synchronized. */
	public void completeComposition() {
		if (composition == null)
			throw new ModelException("Model " + name + " has no composition");
		int added = 0;
		for (Automaton a : automata.values()) {
			for (String action : a.getActions()) {
				if (!composition.isSynchronized(a.name, action)) {
					composition.addSync(Map.of(a.name, action), action);
					added++;
				}
			}
		}
		log.debug("Added {} identity synchronization vectors", added);
	}

	/** The union of the actions of all automata, sorted. */
	public SortedSet<String> getActions() {
		TreeSet<String> ret = new TreeSet<>();
		for (Automaton a : automata.values())
			ret.addAll(a.getActions());
		return ret;
	}

	/** Prepare an expression for output: expand the macros and
	 * lower comparisons with constant arrays. */
	public Expression finish(Expression e) {
		return ArrayComparisonLowering.lower(MacroExpansion.expand(e, getConstantValues()));
	}

	public List<String> getFeatures() {
		boolean arrays = false, trig = false;
		ArrayList<JaniVariable> vars = new ArrayList<>(globalVars.values());
		for (Automaton a : automata.values())
			vars.addAll(a.getVariables());
		for (JaniVariable v : vars)
			arrays |= v.type.isArray();
		ArrayList<Expression> exps = new ArrayList<>();
		for (Automaton a : automata.values()) {
			for (Edge e : a.getEdges()) {
				if (e.getGuard() != null)
					exps.add(e.getGuard());
				for (Destination d : e.getDestinations()) {
					for (Assignment as : d.getAssignments())
						exps.add(as.value);
				}
			}
		}
		for (JaniVariable v : vars)
			exps.add(v.initial);
		for (Expression e : exps)
			trig |= e.containsOperator(Operator.SIN) || e.containsOperator(Operator.COS);
		ArrayList<String> ret = new ArrayList<>();
		if (arrays)
			ret.add("arrays");
		if (trig)
			ret.add("trigonometric-functions");
		return ret;
	}

	public void writeJani(PrintStream out)
	{
		if (composition == null)
			throw new ModelException("Model " + name + " has no composition");
		out.println("{\"jani-version\": 1,");
		out.println("\"name\": " + JaniUtils.quote(name) + ",");
		out.println("\"type\": \"mdp\",");
		out.print("\"features\": [");
		boolean first = true;
		for (String f : getFeatures()) {
			if (!first)
				out.print(", ");
			first = false;
			out.print(JaniUtils.quote(f));
		}
		out.println("],");
		out.println("\"metadata\": {\"description\": " + JaniUtils.quote(description) + "},");
		out.print("\"variables\": [");
		first = true;
		for (JaniVariable v : globalVars.values()) {
			out.println(first ? "" : ",");
			first = false;
			v.printJani(out, 1, this);
		}
		out.println(first ? "]," : "\n],");
		out.print("\"constants\": [");
		first = true;
		for (JaniConstant c : constants.values()) {
			out.println(first ? "" : ",");
			first = false;
			c.printJani(out, 1, this);
		}
		out.println(first ? "]," : "\n],");
		/* List of all actions */
		out.print("\"actions\": [");
		first = true;
		for (String a : getActions()) {
			out.println(first ? "" : ",");
			first = false;
			out.print("\t{\"name\": " + JaniUtils.quote(a) + "}");
		}
		out.println(first ? "]," : "\n],");
		out.print("\"automata\": [");
		first = true;
		for (Automaton a : automata.values()) {
			out.println(first ? "" : ",");
			first = false;
			a.printJaniAutomaton(out, this);
		}
		out.println(first ? "]," : "\n],");
		composition.printJani(out);
		out.println(",");
		out.print("\"properties\": [");
		first = true;
		for (Property p : properties) {
			out.println(first ? "" : ",");
			first = false;
			p.printJani(out, 1, this);
		}
		out.println(first ? "]" : "\n]");
		out.println("}");
		out.flush();
	}
}
