package nl.utwente.ewi.fmt.SC2JANI.expression;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/** A constant array ("av"), possibly nested for more dimensions. */
public class ArrayValueExpression extends Expression
{
	public final List<Expression> elements;

	public ArrayValueExpression(List<? extends Expression> elements)
	{
		for (Expression e : elements) {
			if (e == null)
				throw new IllegalArgumentException("Null array element");
		}
		this.elements = List.copyOf(elements);
	}

	public int length() {
		return elements.size();
	}

	public List<Expression> getChildren() {
		return elements;
	}

	public Expression mapChildren(UnaryOperator<Expression> f) {
		ArrayList<Expression> mapped = new ArrayList<>(elements.size());
		boolean changed = false;
		for (Expression e : elements) {
			Expression n = f.apply(e);
			changed |= n != e;
			mapped.add(n);
		}
		return changed ? new ArrayValueExpression(mapped) : this;
	}

	public boolean isLiteral() {
		for (Expression e : elements) {
			if (!e.isLiteral())
				return false;
		}
		return true;
	}

	public void writeJani(PrintStream out, int indent) {
		out.print("{\"op\": \"av\", \"elements\": [");
		for (int i = 0; i < elements.size(); i++) {
			if (i > 0)
				out.print(", ");
			elements.get(i).writeJani(out, indent);
		}
		out.print("]}");
	}

	public int hashCode() {
		return 17 + elements.hashCode();
	}

	public boolean equals(Object other) {
		if (!(other instanceof ArrayValueExpression))
			return false;
		return elements.equals(((ArrayValueExpression)other).elements);
	}

	public String toString() {
		StringBuilder ret = new StringBuilder("[");
		for (int i = 0; i < elements.size(); i++) {
			if (i > 0)
				ret.append(", ");
			ret.append(elements.get(i));
		}
		return ret.append(']').toString();
	}
}
