package nl.utwente.ewi.fmt.SC2JANI.expression;

import java.util.ArrayList;
import java.util.List;

import nl.utwente.ewi.fmt.SC2JANI.ExpressionTypeException;

/**
 * Replaces distributions by a finite set of equally likely values,
 * for targets that have no native support for sampling.
 */
public class DistributionExpansion
{
	private DistributionExpansion() { }

	/**
	 * Returns every expression obtained by replacing each
	 * distribution by one of its discrete options, in lexicographic
	 * order of the choices. An expression without distributions
	 * yields a single-element list containing itself.
	 *
	 * @param options The number of values each distribution is
	 * replaced by.
	 */
	public static List<Expression> expand(Expression e, int options) {
		if (options < 1)
			throw new IllegalArgumentException("Need at least one option per distribution, not " + options);
		if (!e.containsDistribution())
			return List.of(e);
		if (e instanceof DistributionExpression)
			return discretize((DistributionExpression)e, options);

		List<Expression> children = e.getChildren();
		ArrayList<List<Expression>> choices = new ArrayList<>(children.size());
		for (Expression c : children)
			choices.add(expand(c, options));
		ArrayList<Expression> ret = new ArrayList<>();
		int[] selected = new int[children.size()];
		while (true) {
			int[] pos = new int[1];
			ret.add(e.mapChildren(c -> choices.get(pos[0]).get(selected[pos[0]++])));
			/* Advance the rightmost operand first. */
			int i = selected.length - 1;
			while (i >= 0 && ++selected[i] == choices.get(i).size()) {
				selected[i] = 0;
				i--;
			}
			if (i < 0)
				return ret;
		}
	}

	private static List<Expression> discretize(DistributionExpression d, int options) {
		double lb = bound(d.lowerBound(), d);
		double ub = bound(d.upperBound(), d);
		ArrayList<Expression> ret = new ArrayList<>(options);
		for (int k = 0; k < options; k++)
			ret.add(new ConstantExpression(lb + k * (ub - lb) / options));
		return ret;
	}

	private static double bound(Expression b, DistributionExpression d) {
		if (!(b instanceof ConstantExpression) || ((ConstantExpression)b).isBoolean())
			throw new ExpressionTypeException("Bounds of " + d + " should be numeric literals");
		return ((ConstantExpression)b).numberValue().doubleValue();
	}
}
