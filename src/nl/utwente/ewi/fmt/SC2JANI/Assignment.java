package nl.utwente.ewi.fmt.SC2JANI;

import java.io.PrintStream;

import nl.utwente.ewi.fmt.SC2JANI.expression.Expression;
import nl.utwente.ewi.fmt.SC2JANI.expression.Operator;
import nl.utwente.ewi.fmt.SC2JANI.expression.OperatorExpression;
import nl.utwente.ewi.fmt.SC2JANI.expression.VariableExpression;

/**
 * Assignment of a value to a variable or an array element.
 * Assignments with a lower index are executed first; those with the
 * same index are executed simultaneously.
 */
public class Assignment
{
	public final Expression ref;
	public final Expression value;
	public final int index;

	public Assignment(Expression ref, Expression value, int index)
	{
		if (!(ref instanceof VariableExpression)
		    && !(ref instanceof OperatorExpression
		         && ((OperatorExpression)ref).op == Operator.ARRAY_ACCESS))
		{
			throw new ExpressionTypeException("Cannot assign to " + ref);
		}
		if (value == null)
			throw new NullPointerException("Assignment to " + ref + " without value");
		if (index < 0)
			throw new IllegalArgumentException("Negative assignment index: " + index);
		this.ref = ref;
		this.value = value;
		this.index = index;
	}

	public Assignment(String var, Expression value, int index)
	{
		this(new VariableExpression(var), value, index);
	}

	/** The variable written by this assignment, for element
	 * assignments the array. */
	public String getVariable() {
		Expression e = ref;
		while (e instanceof OperatorExpression)
			e = ((OperatorExpression)e).getOperand("exp");
		return ((VariableExpression)e).variable;
	}

	public Assignment withValue(Expression newValue) {
		if (newValue == value)
			return this;
		return new Assignment(ref, newValue, index);
	}

	public void printJani(PrintStream out, JaniModel model) {
		out.print("{\"ref\": ");
		ref.writeJani(out, 0);
		out.print(", \"value\": ");
		model.finish(value).writeJani(out, 0);
		out.print(", \"index\": " + index + "}");
	}

	public String toString() {
		return ref + " := " + value + " [" + index + "]";
	}
}
