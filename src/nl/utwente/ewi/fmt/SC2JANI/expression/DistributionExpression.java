package nl.utwente.ewi.fmt.SC2JANI.expression;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

import nl.utwente.ewi.fmt.SC2JANI.ExpressionTypeException;
import nl.utwente.ewi.fmt.SC2JANI.UnknownOperatorException;

/**
 * A value drawn from a probability distribution. Only the
 * continuous uniform distribution is supported; its arguments are
 * the lower and upper bound.
 */
public class DistributionExpression extends Expression
{
	public static final String UNIFORM = "Uniform";

	public final String kind;
	public final List<Expression> args;

	public DistributionExpression(String kind, List<? extends Expression> args)
	{
		if (!UNIFORM.equals(kind))
			throw new UnknownOperatorException("distribution " + kind);
		if (args.size() != 2)
			throw new ExpressionTypeException("Uniform distribution takes 2 arguments, found " + args.size());
		Expression lb = args.get(0), ub = args.get(1);
		if (lb instanceof ConstantExpression && ub instanceof ConstantExpression) {
			ConstantExpression l = (ConstantExpression)lb;
			ConstantExpression u = (ConstantExpression)ub;
			if (l.isBoolean() || u.isBoolean())
				throw new ExpressionTypeException("Uniform distribution over booleans");
			if (l.numberValue().doubleValue() > u.numberValue().doubleValue())
				throw new ExpressionTypeException("Uniform distribution with lower bound " + lb + " above upper bound " + ub);
		}
		this.kind = kind;
		this.args = List.copyOf(args);
	}

	public static DistributionExpression uniform(double lower, double upper) {
		return new DistributionExpression(UNIFORM, List.of(
				new ConstantExpression(lower),
				new ConstantExpression(upper)));
	}

	public Expression lowerBound() {
		return args.get(0);
	}

	public Expression upperBound() {
		return args.get(1);
	}

	public List<Expression> getChildren() {
		return args;
	}

	public Expression mapChildren(UnaryOperator<Expression> f) {
		ArrayList<Expression> mapped = new ArrayList<>();
		boolean changed = false;
		for (Expression e : args) {
			Expression n = f.apply(e);
			changed |= n != e;
			mapped.add(n);
		}
		return changed ? new DistributionExpression(kind, mapped) : this;
	}

	public boolean containsDistribution() {
		return true;
	}

	public void writeJani(PrintStream out, int indent) {
		out.print("{\"distribution\": \"" + kind + "\", \"args\": [");
		for (int i = 0; i < args.size(); i++) {
			if (i > 0)
				out.print(", ");
			args.get(i).writeJani(out, indent);
		}
		out.print("]}");
	}

	public int hashCode() {
		return kind.hashCode() + 31 * args.hashCode();
	}

	public boolean equals(Object other) {
		if (!(other instanceof DistributionExpression))
			return false;
		DistributionExpression o = (DistributionExpression)other;
		return kind.equals(o.kind) && args.equals(o.args);
	}

	public String toString() {
		return kind + "(" + args.get(0) + ", " + args.get(1) + ")";
	}
}
