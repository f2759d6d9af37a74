package nl.utwente.ewi.fmt.SC2JANI.expression;

import java.util.List;

import org.junit.jupiter.api.Test;

import nl.utwente.ewi.fmt.SC2JANI.ExpressionTypeException;

import static org.junit.jupiter.api.Assertions.*;

public class ArrayComparisonLoweringTest
{
	private static ArrayValueExpression array(long... values) {
		ConstantExpression[] elements = new ConstantExpression[values.length];
		for (int i = 0; i < values.length; i++)
			elements[i] = new ConstantExpression(values[i]);
		return new ArrayValueExpression(List.of(elements));
	}

	@Test
	void comparesLengthAndElements() {
		Expression x = new VariableExpression("x");
		Expression e = new OperatorExpression(Operator.EQUALS, x, array(1, 2));
		Expression lowered = ArrayComparisonLowering.lower(e);
		assertEquals(ExpressionParser.parse("x.length == 2 && x[0] == 1 && x[1] == 2"), lowered);
	}

	@Test
	void literalOnLeft() {
		Expression e = ExpressionParser.parse("\"a\" == name");
		assertEquals(ExpressionParser.parse("name.length == 1 && name[0] == 97"),
		             ArrayComparisonLowering.lower(e));
	}

	@Test
	void nestedInsideGuard() {
		Expression e = ExpressionParser.parse("ok && _event.id == \"b\"");
		assertEquals(ExpressionParser.parse("ok && (_event.id.length == 1 && _event.id[0] == 98)"),
		             ArrayComparisonLowering.lower(e));
	}

	@Test
	void rowOfArray() {
		Expression e = new OperatorExpression(Operator.EQUALS,
				ExpressionParser.parse("m[2]"), array(5));
		assertEquals(ExpressionParser.parse("m[2].length == 1 && m[2][0] == 5"),
		             ArrayComparisonLowering.lower(e));
	}

	@Test
	void twoLiterals() {
		Expression same = new OperatorExpression(Operator.EQUALS, array(1, 2), array(1, 2));
		Expression different = new OperatorExpression(Operator.EQUALS, array(1, 2), array(1));
		assertEquals(ConstantExpression.TRUE, ArrayComparisonLowering.lower(same));
		assertEquals(ConstantExpression.FALSE, ArrayComparisonLowering.lower(different));
	}

	@Test
	void wholeArrayValueKept() {
		ArrayValueExpression a = array(3, 4);
		assertSame(a, ArrayComparisonLowering.lower(a));
	}

	@Test
	void otherOperatorsRejected() {
		Expression e = new OperatorExpression(Operator.NOT_EQUALS, new VariableExpression("x"), array(1));
		assertThrows(ExpressionTypeException.class, () -> ArrayComparisonLowering.lower(e));
	}
}
