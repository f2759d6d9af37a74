package nl.utwente.ewi.fmt.SC2JANI.expression;

import java.io.PrintStream;
import java.util.Objects;
import java.util.Set;

import nl.utwente.ewi.fmt.SC2JANI.UnknownOperatorException;

/**
 * A literal value: a Long, a Double, a Boolean, or one of the named
 * mathematical constants.
 */
public class ConstantExpression extends Expression
{
	public final static ConstantExpression TRUE = new ConstantExpression(true);
	public final static ConstantExpression FALSE = new ConstantExpression(false);
	public final static ConstantExpression ZERO = new ConstantExpression(0L);
	public final static ConstantExpression PI = new ConstantExpression(Math.PI, "π");
	public final static ConstantExpression E = new ConstantExpression(Math.E, "e");

	public final Object value;
	/** "π" or "e" for named constants, otherwise null. */
	public final String name;

	public ConstantExpression(Number val) {
		if (val instanceof Integer || val instanceof Short || val instanceof Byte)
			val = val.longValue();
		else if (val instanceof Float)
			val = val.doubleValue();
		if (!(val instanceof Long) && !(val instanceof Double))
			throw new IllegalArgumentException("Unsupported literal type: " + val.getClass());
		if (val instanceof Double && !Double.isFinite((Double)val))
			throw new IllegalArgumentException("Non-finite literal: " + val);
		value = val;
		name = null;
	}

	public ConstantExpression(boolean val) {
		value = val;
		name = null;
	}

	private ConstantExpression(double val, String name) {
		value = val;
		this.name = name;
	}

	public static ConstantExpression named(String name) {
		if (PI.name.equals(name))
			return PI;
		if (E.name.equals(name))
			return E;
		throw new UnknownOperatorException("constant " + name);
	}

	public boolean isBoolean() {
		return value instanceof Boolean;
	}

	public boolean isInteger() {
		return value instanceof Long;
	}

	public boolean isReal() {
		return value instanceof Double;
	}

	public Number numberValue() {
		if (value instanceof Boolean)
			return ((Boolean)value) ? 1L : 0L;
		return (Number)value;
	}

	public boolean isLiteral() {
		return true;
	}

	public Set<String> getReferencedVariables() {
		return Set.of();
	}

	public void writeJani(PrintStream out, int indent) {
		if (name != null)
			out.print("{\"constant\": \"" + name + "\"}");
		else
			out.print(value);
	}

	public int hashCode() {
		return Objects.hash(value, name);
	}

	public boolean equals(Object other) {
		if (!(other instanceof ConstantExpression))
			return false;
		ConstantExpression o = (ConstantExpression)other;
		return value.equals(o.value) && Objects.equals(name, o.name);
	}

	public String toString() {
		if (this == PI || PI.equals(this))
			return "Math.PI";
		if (this == E || E.equals(this))
			return "Math.E";
		if (value instanceof Number && ((Number)value).doubleValue() < 0)
			return "(" + value + ")";
		return value.toString();
	}
}
