package nl.utwente.ewi.fmt.SC2JANI;

import java.io.PrintStream;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import nl.utwente.ewi.fmt.SC2JANI.expression.Expression;

/**
 * A probabilistic reachability property over the initial states:
 * the minimal or maximal probability of a path formula.
 */
public class Property
{
	/** The temporal operator of the path formula. */
	public enum Type {
		EVENTUALLY("F"),
		ALWAYS("G"),
		UNTIL("U"),
		WEAK_UNTIL("W");

		public final String symbol;

		Type(String symbol) {
			this.symbol = symbol;
		}

		public boolean isBinary() {
			return this == UNTIL || this == WEAK_UNTIL;
		}

		static Type fromSymbol(Object symbol) {
			for (Type t : values()) {
				if (t.symbol.equals(symbol))
					return t;
			}
			throw new UnsupportedOperationException("Unsupported path operator: " + symbol);
		}
	};

	public final String name;
	public final String fun;
	public final boolean maximize;
	public final Type type;
	/** Left operand of binary operators, null otherwise. */
	public final Expression left;
	public final Expression right;
	public final Expression lowerStepBound, upperStepBound;

	public Property(String name, String fun, boolean maximize, Type type,
	                Expression left, Expression right,
	                Expression lowerStepBound, Expression upperStepBound)
	{
		if (type.isBinary() != (left != null))
			throw new IllegalArgumentException("Operator " + type.symbol + (type.isBinary() ? " needs" : " takes no") + " left operand");
		this.name = name;
		this.fun = fun;
		this.maximize = maximize;
		this.type = type;
		this.left = left;
		this.right = right;
		this.lowerStepBound = lowerStepBound;
		this.upperStepBound = upperStepBound;
	}

	/**
	 * Read a property from its JANI form.
	 * @throws UnsupportedOperationException if the property is not
	 * a Pmin/Pmax filter over the initial states.
	 */
	public static Property fromJani(Map<?, ?> prop)
	{
		Object nameO = prop.get("name");
		if (!(nameO instanceof String))
			throw new IllegalArgumentException("Property name should be string, not: " + nameO);
		String name = (String) nameO;
		Object expO = prop.get("expression");
		if (!(expO instanceof Map))
			throw new IllegalArgumentException("Property expression should be object, not: " + expO);
		Map<?, ?> expr = (Map<?, ?>)expO;
		if (!"filter".equals(expr.get("op")))
			throw new UnsupportedOperationException("Unsupported property operation '" + expr.get("op") + "' in property " + name);
		Object fun = expr.get("fun");
		if (!("max".equals(fun) || "min".equals(fun) || "avg".equals(fun) || "values".equals(fun)))
			throw new UnsupportedOperationException("Unsupported property function: " + fun);
		Object states = expr.get("states");
		if (!(states instanceof Map) || !"initial".equals(((Map<?, ?>)states).get("op")))
			throw new UnsupportedOperationException("Only properties over initial states currently supported.");
		Object valO = expr.get("values");
		if (!(valO instanceof Map))
			throw new IllegalArgumentException("Property values should be object, not: " + valO);
		Map<?, ?> values = (Map<?, ?>)valO;
		Object op = values.get("op");
		boolean max;
		if ("Pmax".equals(op))
			max = true;
		else if ("Pmin".equals(op))
			max = false;
		else
			throw new UnsupportedOperationException("Unsupported property operation: " + op);
		Object pathO = values.get("exp");
		if (!(pathO instanceof Map))
			throw new UnsupportedOperationException("Expected path formula in property " + name + ", found: " + pathO);
		Map<?, ?> path = (Map<?, ?>)pathO;
		Type type = Type.fromSymbol(path.get("op"));
		Expression left = null, right;
		if (type.isBinary()) {
			left = operand(path, "left", name);
			right = operand(path, "right", name);
		} else {
			right = operand(path, "exp", name);
		}
		Expression lower = null, upper = null;
		Object boundO = path.get("step-bounds");
		if (boundO != null) {
			if (!(boundO instanceof Map))
				throw new IllegalArgumentException("Step bounds should be object, not: " + boundO);
			Map<?, ?> bound = (Map<?, ?>)boundO;
			for (Object o : bound.keySet()) {
				if ("lower".equals(o))
					lower = Expression.fromJani(bound.get(o));
				else if ("upper".equals(o))
					upper = Expression.fromJani(bound.get(o));
				else
					throw new UnsupportedOperationException("Unsupported step bound: " + o);
			}
		}
		if (path.containsKey("time-bounds") || path.containsKey("reward-bounds"))
			throw new UnsupportedOperationException("Only step-bounded properties are supported, ignoring property '" + name + "'");
		return new Property(name, (String)fun, max, type, left, right, lower, upper);
	}

	private static Expression operand(Map<?, ?> path, String key, String name) {
		Object o = path.get(key);
		if (o == null)
			throw new IllegalArgumentException("Operator " + path.get("op") + " in property " + name + " without operand '" + key + "'");
		return Expression.fromJani(o);
	}

	public Set<String> getReferencedVariables() {
		TreeSet<String> ret = new TreeSet<>();
		if (left != null)
			ret.addAll(left.getReferencedVariables());
		ret.addAll(right.getReferencedVariables());
		return ret;
	}

	public void printJani(PrintStream out, int indent, JaniModel model)
	{
		String tabs = JaniUtils.tabs(indent);
		out.println(tabs + "{\"name\": " + JaniUtils.quote(name) + ",");
		out.println(tabs + " \"expression\": {");
		out.println(tabs + "\t\"op\": \"filter\",");
		out.println(tabs + "\t\"fun\": " + JaniUtils.quote(fun) + ",");
		out.println(tabs + "\t\"states\": {\"op\": \"initial\"},");
		out.println(tabs + "\t\"values\": {");
		out.println(tabs + "\t\t\"op\": \"" + (maximize ? "Pmax" : "Pmin") + "\",");
		out.print(tabs + "\t\t\"exp\": {\"op\": \"" + type.symbol + "\"");
		if (type.isBinary()) {
			out.print(", \"left\": ");
			model.finish(left).writeJani(out, indent + 3);
			out.print(", \"right\": ");
		} else {
			out.print(", \"exp\": ");
		}
		model.finish(right).writeJani(out, indent + 3);
		if (lowerStepBound != null || upperStepBound != null) {
			out.print(", \"step-bounds\": {");
			if (lowerStepBound != null) {
				out.print("\"lower\": ");
				model.finish(lowerStepBound).writeJani(out, indent + 3);
			}
			if (upperStepBound != null) {
				if (lowerStepBound != null)
					out.print(", ");
				out.print("\"upper\": ");
				model.finish(upperStepBound).writeJani(out, indent + 3);
			}
			out.print("}");
		}
		out.println("}");
		out.println(tabs + "\t\t}");
		out.println(tabs + "\t}");
		out.print(tabs + '}');
	}
}
