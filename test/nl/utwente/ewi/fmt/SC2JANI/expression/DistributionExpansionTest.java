package nl.utwente.ewi.fmt.SC2JANI.expression;

import java.util.List;

import org.junit.jupiter.api.Test;

import nl.utwente.ewi.fmt.SC2JANI.ExpressionTypeException;

import static org.junit.jupiter.api.Assertions.*;

public class DistributionExpansionTest
{
	@Test
	void withoutDistribution() {
		Expression e = ExpressionParser.parse("x + 1");
		assertEquals(List.of(e), DistributionExpansion.expand(e, 5));
	}

	@Test
	void uniformOptions() {
		List<Expression> values = DistributionExpansion.expand(DistributionExpression.uniform(0.0, 1.0), 4);
		assertEquals(List.of(new ConstantExpression(0.0), new ConstantExpression(0.25),
		                     new ConstantExpression(0.5), new ConstantExpression(0.75)),
		             values);
	}

	@Test
	void insideExpression() {
		List<Expression> values = DistributionExpansion.expand(ExpressionParser.parse("Math.random() * 10"), 2);
		assertEquals(2, values.size());
		assertEquals(ExpressionParser.parse("0.0 * 10"), values.get(0));
		assertEquals(ExpressionParser.parse("0.5 * 10"), values.get(1));
	}

	@Test
	void combinesIndependentDistributions() {
		Expression e = ExpressionParser.parse("Math.random() + Math.random()");
		List<Expression> values = DistributionExpansion.expand(e, 3);
		assertEquals(9, values.size());
		for (Expression v : values)
			assertFalse(v.containsDistribution());
		assertEquals(ExpressionParser.parse("0.0 + 0.0"), values.get(0));
		assertEquals(ExpressionParser.parse("0.0 + " + (1.0 / 3)), values.get(1));
	}

	@Test
	void invalidArguments() {
		assertThrows(IllegalArgumentException.class,
				() -> DistributionExpansion.expand(ExpressionParser.parse("x"), 0));
		Expression symbolic = new DistributionExpression(DistributionExpression.UNIFORM,
				List.of(new VariableExpression("lo"), new ConstantExpression(1.0)));
		assertThrows(ExpressionTypeException.class, () -> DistributionExpansion.expand(symbolic, 2));
	}
}
