package nl.utwente.ewi.fmt.SC2JANI.expression;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

public class OperatorExpression extends Expression
{
	public final Operator op;
	private final Map<String, Expression> operands;
	private final int hash;

	/** Create an operator expression from its operands, in the order
	 * listed by {@link Operator#operands}.
	 */
	public OperatorExpression(Operator op, Expression... operands)
	{
		this(op, toMap(op, operands));
	}

	public OperatorExpression(Operator op, Map<String, Expression> operands)
	{
		if (!operands.keySet().equals(new HashSet<>(op.operands)))
			throw new IllegalArgumentException("Operator " + op.symbol + " takes operands " + op.operands + ", not " + operands.keySet());
		LinkedHashMap<String, Expression> ordered = new LinkedHashMap<>();
		for (String name : op.operands) {
			Expression e = operands.get(name);
			if (e == null)
				throw new IllegalArgumentException("Missing operand '" + name + "' of " + op.symbol);
			ordered.put(name, e);
		}
		this.op = op;
		this.operands = Collections.unmodifiableMap(ordered);
		hash = op.hashCode() + 31 * ordered.hashCode();
	}

	private static Map<String, Expression> toMap(Operator op, Expression[] operands) {
		if (operands.length != op.operands.size())
			throw new IllegalArgumentException("Operator " + op.symbol + " takes " + op.operands.size() + " operands, not " + operands.length);
		LinkedHashMap<String, Expression> ret = new LinkedHashMap<>();
		for (int i = 0; i < operands.length; i++)
			ret.put(op.operands.get(i), operands[i]);
		return ret;
	}

	public Expression getOperand(String name) {
		Expression ret = operands.get(name);
		if (ret == null)
			throw new IllegalArgumentException("Operator " + op.symbol + " has no operand " + name);
		return ret;
	}

	public Map<String, Expression> getOperands() {
		return operands;
	}

	public List<Expression> getChildren() {
		return new ArrayList<>(operands.values());
	}

	public Expression mapChildren(UnaryOperator<Expression> f) {
		LinkedHashMap<String, Expression> mapped = new LinkedHashMap<>();
		boolean changed = false;
		for (Map.Entry<String, Expression> e : operands.entrySet()) {
			Expression n = f.apply(e.getValue());
			changed |= n != e.getValue();
			mapped.put(e.getKey(), n);
		}
		if (!changed)
			return this;
		return new OperatorExpression(op, mapped);
	}

	public boolean containsOperator(Operator o) {
		return op == o || super.containsOperator(o);
	}

	public boolean containsMacro() {
		return op.macro || super.containsMacro();
	}

	public void writeJani(PrintStream out, int indent) {
		out.print("{\"op\": \"");
		out.print(op.symbol);
		out.print("\"");
		for (Map.Entry<String, Expression> e : operands.entrySet()) {
			out.print(", \"" + e.getKey() + "\": ");
			e.getValue().writeJani(out, indent);
		}
		out.print("}");
	}

	public int hashCode() {
		return hash;
	}

	public boolean equals(Object other) {
		if (other == this)
			return true;
		if (!(other instanceof OperatorExpression))
			return false;
		OperatorExpression o = (OperatorExpression)other;
		return hash == o.hash && op == o.op && operands.equals(o.operands);
	}

	private static String infix(Operator op) {
		switch (op) {
		case EQUALS: return "==";
		case NOT_EQUALS: return "!=";
		case LESS_OR_EQUAL: return "<=";
		case GREATER_OR_EQUAL: return ">=";
		case AND: return "&&";
		case OR: return "||";
		case IMPLIES: return "=>";
		case LESS: case GREATER: case ADD: case SUBTRACT:
		case MULTIPLY: case DIVIDE: case MODULO:
			return op.symbol;
		default:
			return null;
		}
	}

	public String toString() {
		String sym = infix(op);
		if (sym != null)
			return '(' + operands.get("left").toString() + ' ' + sym + ' ' + operands.get("right").toString() + ')';
		switch (op) {
		case NOT:
			return "!(" + operands.get("exp") + ')';
		case ITE:
			return "(" + operands.get("if") + " ? " + operands.get("then") + " : " + operands.get("else") + ')';
		case ARRAY_ACCESS:
			return operands.get("exp").toString() + '[' + operands.get("index") + ']';
		case POW: case LOG: case MIN: case MAX:
		case FLOOR: case CEIL: case ABS: case SIN: case COS:
			return "Math." + op.symbol + argumentList();
		default:
			return op.symbol + argumentList();
		}
	}

	private String argumentList() {
		StringBuilder ret = new StringBuilder("(");
		boolean first = true;
		for (Expression e : operands.values()) {
			if (!first)
				ret.append(", ");
			first = false;
			ret.append(e);
		}
		return ret.append(')').toString();
	}
}
