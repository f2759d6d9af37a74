package nl.utwente.ewi.fmt.SC2JANI.expression;

import java.util.List;

import nl.utwente.ewi.fmt.SC2JANI.ExpressionTypeException;

/**
 * Rewrites comparisons of an array with a constant array into a
 * check of the length variable and of each element, as model
 * checkers cannot compare arrays of different capacity.
 */
public class ArrayComparisonLowering
{
	private ArrayComparisonLowering() { }

	public static Expression lower(Expression e) {
		if (e instanceof ArrayValueExpression) {
			/* A whole array value, as assigned to a variable. */
			return e;
		}
		if (!(e instanceof OperatorExpression))
			return e.mapChildren(ArrayComparisonLowering::lower);
		OperatorExpression oe = (OperatorExpression)e;
		if (oe.op == Operator.EQUALS) {
			Expression l = oe.getOperand("left");
			Expression r = oe.getOperand("right");
			if (l instanceof ArrayValueExpression && r instanceof ArrayValueExpression)
				return new ConstantExpression(l.equals(r));
			if (r instanceof ArrayValueExpression)
				return compare(l, (ArrayValueExpression)r);
			if (l instanceof ArrayValueExpression)
				return compare(r, (ArrayValueExpression)l);
		} else {
			for (Expression c : oe.getChildren()) {
				if (c instanceof ArrayValueExpression)
					throw new ExpressionTypeException("Array value " + c + " can only be compared using '==', found in " + e);
			}
		}
		return e.mapChildren(ArrayComparisonLowering::lower);
	}

	private static Expression compare(Expression array, ArrayValueExpression value) {
		List<Expression> elements = value.elements;
		Expression ret = new OperatorExpression(Operator.EQUALS,
				ExpressionParser.lengthOf(array),
				new ConstantExpression((long)elements.size()));
		for (int i = 0; i < elements.size(); i++) {
			Expression element = new OperatorExpression(Operator.ARRAY_ACCESS,
					array, new ConstantExpression((long)i));
			Expression check = lower(new OperatorExpression(Operator.EQUALS,
					element, elements.get(i)));
			ret = new OperatorExpression(Operator.AND, ret, check);
		}
		return ret;
	}
}
