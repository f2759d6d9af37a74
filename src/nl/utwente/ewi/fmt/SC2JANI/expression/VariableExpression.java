package nl.utwente.ewi.fmt.SC2JANI.expression;

import java.io.PrintStream;
import java.util.Set;
import java.util.function.UnaryOperator;

import nl.utwente.ewi.fmt.SC2JANI.JaniUtils;

public class VariableExpression extends Expression
{
	public final String variable;

	public VariableExpression(String var) {
		if (var == null || var.isEmpty())
			throw new IllegalArgumentException("Empty identifier");
		variable = var;
	}

	public Set<String> getReferencedVariables() {
		return Set.of(variable);
	}

	public Expression renameVars(UnaryOperator<String> renamer) {
		String renamed = renamer.apply(variable);
		if (renamed.equals(variable))
			return this;
		return new VariableExpression(renamed);
	}

	public void writeJani(PrintStream out, int indent) {
		out.print(JaniUtils.quote(variable));
	}

	public int hashCode() {
		return variable.hashCode();
	}

	public boolean equals(Object other) {
		if (!(other instanceof VariableExpression))
			return false;
		return ((VariableExpression)other).variable.equals(variable);
	}

	public String toString() {
		return variable;
	}
}
