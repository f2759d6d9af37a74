package nl.utwente.ewi.fmt.SC2JANI.expression;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.UnaryOperator;

import nl.utwente.ewi.fmt.SC2JANI.UnknownOperatorException;

public abstract class Expression
{
	/** Prefix of identifiers referring to the data of the event that
	 * triggered the current transition.
	 */
	public static final String EVENT_PREFIX = "_event.";

	/** Get the set of variables and constants referenced anywhere
	 * in the expression.
	 */
	public Set<String> getReferencedVariables() {
		TreeSet<String> ret = new TreeSet<>();
		for (Expression child : getChildren())
			ret.addAll(child.getReferencedVariables());
		return ret;
	}

	/** The direct subexpressions, in operand order. */
	public List<Expression> getChildren() {
		return List.of();
	}

	/** Return an expression of the same shape, with each direct
	 * subexpression replaced by the result of f.
	 */
	public Expression mapChildren(UnaryOperator<Expression> f) {
		return this;
	}

	public boolean containsOperator(Operator op) {
		for (Expression child : getChildren()) {
			if (child.containsOperator(op))
				return true;
		}
		return false;
	}

	public boolean containsMacro() {
		for (Expression child : getChildren()) {
			if (child.containsMacro())
				return true;
		}
		return false;
	}

	public boolean containsDistribution() {
		for (Expression child : getChildren()) {
			if (child.containsDistribution())
				return true;
		}
		return false;
	}

	public Expression renameVars(Map<String, String> renames) {
		return renameVars(v -> renames.getOrDefault(v, v));
	}

	public Expression renameVars(UnaryOperator<String> renamer) {
		return mapChildren(c -> c.renameVars(renamer));
	}

	/** Replace references to the triggering event's data
	 * ("_event.x") by references to the named event ("e.x").
	 */
	public Expression replaceEvent(String event) {
		if (event == null)
			return this;
		return renameVars(v -> {
			if (v.startsWith(EVENT_PREFIX))
				return event + "." + v.substring(EVENT_PREFIX.length());
			return v;
		});
	}

	public boolean isLiteral() {
		return false;
	}

	public static Expression fromJani(Object o)
	{
		if (o instanceof Boolean)
			return new ConstantExpression((Boolean)o);
		if (o instanceof Number)
			return new ConstantExpression((Number)o);
		if (o instanceof String)
			return new VariableExpression((String)o);
		if (o instanceof Map) {
			Map<?, ?> e = (Map<?, ?>)o;
			if (e.containsKey("exp") && e.size() == 1)
				return fromJani(e.get("exp"));
			Object constant = e.get("constant");
			if (constant != null)
				return ConstantExpression.named(constant.toString());
			Object dist = e.get("distribution");
			if (dist != null) {
				Object args = e.get("args");
				if (!(args instanceof Object[]))
					throw new IllegalArgumentException("Distribution arguments should be an array: " + o);
				return new DistributionExpression(dist.toString(),
						fromJaniList((Object[])args));
			}
			Object op = e.get("op");
			if (!(op instanceof String))
				throw new IllegalArgumentException("Operator: " + op + " in " + o + " should be string");
			if ("av".equals(op)) {
				Object elements = e.get("elements");
				if (!(elements instanceof Object[]))
					throw new IllegalArgumentException("Array value without elements: " + o);
				return new ArrayValueExpression(fromJaniList((Object[])elements));
			}
			Operator operator = Operator.fromSymbol((String)op);
			LinkedHashMap<String, Expression> operands = new LinkedHashMap<>();
			for (String name : operator.operands) {
				Object operand = e.get(name);
				if (operand == null)
					throw new IllegalArgumentException("Operator " + op + " without operand '" + name + "': " + o);
				operands.put(name, fromJani(operand));
			}
			return new OperatorExpression(operator, operands);
		}
		throw new UnknownOperatorException(String.valueOf(o));
	}

	private static List<Expression> fromJaniList(Object[] list) {
		ArrayList<Expression> ret = new ArrayList<>(list.length);
		for (Object o : list)
			ret.add(fromJani(o));
		return ret;
	}

	public abstract int hashCode();
	public abstract boolean equals(Object other);
	/** Returns the expression in expression-language syntax. */
	public abstract String toString();
	public abstract void writeJani(PrintStream out, int indent);
}
