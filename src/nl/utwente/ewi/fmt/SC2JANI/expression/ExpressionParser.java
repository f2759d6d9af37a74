package nl.utwente.ewi.fmt.SC2JANI.expression;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;

import nl.utwente.ewi.fmt.SC2JANI.ExpressionSyntaxException;
import nl.utwente.ewi.fmt.SC2JANI.ExpressionTypeException;
import nl.utwente.ewi.fmt.SC2JANI.JaniModel.JaniBaseType;
import nl.utwente.ewi.fmt.SC2JANI.UnsupportedConstructException;
import nl.utwente.ewi.fmt.SC2JANI.expression.ExpressionLexer.Token;
import nl.utwente.ewi.fmt.SC2JANI.expression.ExpressionLexer.TokenType;

/**
 * Parser for the expression language embedded in state-chart
 * documents, a subset of ECMAScript expressions.
 *
 * Dotted member access is flattened into a single identifier,
 * indexing becomes array access ("aa"), and ".length" refers to the
 * length variable of the dimension being accessed. String literals
 * are turned into arrays of their UTF-8 byte values, as the target
 * format has no strings. Array and string literals assigned to a
 * variable are padded to the capacity of the target shape, if one
 * is given.
 */
public class ExpressionParser
{
	public static final String LENGTH_PROPERTY = "length";
	public static final String MATH_PREFIX = "Math.";

	private final String source;
	private final ArrayInfo shape;
	private List<Token> tokens;
	private int pos;
	/* String literals not yet consumed by an assignment or
	 * comparison, mapped to their text. */
	private final IdentityHashMap<Expression, String> strings = new IdentityHashMap<>();
	private ArrayValueExpression literal;

	/**
	 * @param source The expression text.
	 * @param shape The shape of the array the expression is
	 * assigned to, or null if it is not assigned to an array.
	 */
	public ExpressionParser(String source, ArrayInfo shape)
	{
		if (source == null)
			throw new IllegalArgumentException("Null expression");
		this.source = source;
		this.shape = shape;
	}

	public static Expression parse(String source) {
		return new ExpressionParser(source, null).parse();
	}

	public static Expression parse(String source, ArrayInfo shape) {
		return new ExpressionParser(source, shape).parse();
	}

	/** Name of the variable holding the length of the given
	 * dimension (counting from 1) of an array.
	 */
	public static String lengthVariable(String array, int dimension) {
		if (dimension < 1)
			throw new IllegalArgumentException("Array dimensions count from 1");
		return array + ".d" + dimension + "_len";
	}

	/** The int array holding the UTF-8 byte values of a string. */
	public static ArrayValueExpression encodeString(String s) {
		ArrayList<Expression> ret = new ArrayList<>();
		for (byte b : s.getBytes(StandardCharsets.UTF_8))
			ret.add(new ConstantExpression((long)(b & 0xff)));
		return new ArrayValueExpression(ret);
	}

	/** If the parsed expression was an array or string literal,
	 * returns it before padding. Used to compute the initial
	 * values of the length variables.
	 */
	public ArrayValueExpression getUnpaddedLiteral() {
		return literal;
	}

	public Expression parse()
	{
		tokens = ExpressionLexer.tokenize(source);
		pos = 0;
		if (peek().type == TokenType.END)
			throw new ExpressionSyntaxException("Empty expression", source);
		Expression ret;
		if (peek().is("[")) {
			literal = arrayLiteral(shape == null ? null : shape.base, shape == null ? -1 : shape.dimensions());
			ret = shape == null ? literal : padDeep(literal, shape);
		} else {
			ret = ternary();
			String s = strings.remove(ret);
			if (s != null) {
				literal = (ArrayValueExpression)ret;
				if (shape != null) {
					if (shape.dimensions() != 1 || shape.base != JaniBaseType.INTEGER)
						throw new ExpressionTypeException("Cannot assign string \"" + s + "\" to an array of type " + shape);
					ret = shape.pad(literal.elements);
				}
			}
		}
		accept(";");
		if (peek().type != TokenType.END)
			throw new ExpressionSyntaxException("Expected exactly one expression statement, found " + peek() + " at position " + peek().position, source);
		if (!strings.isEmpty())
			throw new ExpressionTypeException("String literals can only be assigned or compared using '==': " + source);
		return ret;
	}

	private Token peek() {
		return tokens.get(pos);
	}

	private Token next() {
		Token ret = tokens.get(pos);
		if (ret.type != TokenType.END)
			pos++;
		return ret;
	}

	private boolean accept(String punct) {
		if (peek().is(punct)) {
			pos++;
			return true;
		}
		return false;
	}

	private void expect(String punct) {
		if (!accept(punct))
			throw new ExpressionSyntaxException("Expected '" + punct + "' but found " + peek(), source);
	}

	private Expression ternary() {
		Expression cond = implication();
		if (!accept("?"))
			return cond;
		Expression thenExpr = ternary();
		expect(":");
		Expression elseExpr = ternary();
		return new OperatorExpression(Operator.ITE, cond, thenExpr, elseExpr);
	}

	private Expression implication() {
		Expression left = disjunction();
		if (accept("=>"))
			return new OperatorExpression(Operator.IMPLIES, left, implication());
		return left;
	}

	private Expression disjunction() {
		Expression ret = conjunction();
		while (accept("||"))
			ret = new OperatorExpression(Operator.OR, ret, conjunction());
		return ret;
	}

	private Expression conjunction() {
		Expression ret = equality();
		while (accept("&&"))
			ret = new OperatorExpression(Operator.AND, ret, equality());
		return ret;
	}

	private Expression equality() {
		Expression ret = relational();
		while (true) {
			Operator op;
			if (accept("==") || accept("==="))
				op = Operator.EQUALS;
			else if (accept("!=") || accept("!=="))
				op = Operator.NOT_EQUALS;
			else
				return ret;
			Expression right = relational();
			if (strings.containsKey(ret) || strings.containsKey(right)) {
				if (op != Operator.EQUALS)
					throw new ExpressionTypeException("Strings can only be compared using '==': " + source);
				strings.remove(ret);
				strings.remove(right);
			}
			ret = new OperatorExpression(op, ret, right);
		}
	}

	private Expression relational() {
		Expression ret = additive();
		while (true) {
			Operator op;
			if (accept("<="))
				op = Operator.LESS_OR_EQUAL;
			else if (accept(">="))
				op = Operator.GREATER_OR_EQUAL;
			else if (accept("<"))
				op = Operator.LESS;
			else if (accept(">"))
				op = Operator.GREATER;
			else
				return ret;
			ret = new OperatorExpression(op, ret, additive());
		}
	}

	private Expression additive() {
		Expression ret = multiplicative();
		while (true) {
			if (accept("+"))
				ret = new OperatorExpression(Operator.ADD, ret, multiplicative());
			else if (accept("-"))
				ret = new OperatorExpression(Operator.SUBTRACT, ret, multiplicative());
			else
				return ret;
		}
	}

	private Expression multiplicative() {
		Expression ret = unary();
		while (true) {
			if (accept("*"))
				ret = new OperatorExpression(Operator.MULTIPLY, ret, unary());
			else if (accept("/"))
				ret = new OperatorExpression(Operator.DIVIDE, ret, unary());
			else if (accept("%"))
				ret = new OperatorExpression(Operator.MODULO, ret, unary());
			else
				return ret;
		}
	}

	private Expression unary() {
		if (accept("!"))
			return new OperatorExpression(Operator.NOT, unary());
		if (accept("+"))
			return unary();
		if (accept("-")) {
			if (peek().type == TokenType.NUMBER && !tokens.get(pos + 1).is(".")
			    && !tokens.get(pos + 1).is("["))
			{
				return negate(next());
			}
			return new OperatorExpression(Operator.SUBTRACT, ConstantExpression.ZERO, unary());
		}
		return postfix();
	}

	private ConstantExpression negate(Token t) {
		if (t.value instanceof BigInteger) {
			try {
				return new ConstantExpression(((BigInteger)t.value).negate().longValueExact());
			} catch (ArithmeticException e) {
				throw new ExpressionSyntaxException("Invalid number '-" + t.text + "'", source);
			}
		}
		if (t.value instanceof Long)
			return new ConstantExpression(-(Long)t.value);
		return new ConstantExpression(-(Double)t.value);
	}

	private Number literal(Token t) {
		if (t.value instanceof BigInteger)
			throw new ExpressionSyntaxException("Invalid number '" + t.text + "'", source);
		return (Number)t.value;
	}

	private Expression primary() {
		Token t = next();
		switch (t.type) {
		case NUMBER:
			return new ConstantExpression(literal(t));
		case STRING:
			ArrayValueExpression ret = encodeString((String)t.value);
			strings.put(ret, (String)t.value);
			return ret;
		case IDENTIFIER:
			if (t.text.equals("true"))
				return ConstantExpression.TRUE;
			if (t.text.equals("false"))
				return ConstantExpression.FALSE;
			if (t.text.equals("True") || t.text.equals("False"))
				throw new ExpressionSyntaxException("Boolean " + t.text + " mistaken for an identifier, did you mean '" + t.text.toLowerCase() + "'?", source);
			return new VariableExpression(t.text);
		case PUNCTUATION:
			if (t.text.equals("(")) {
				Expression inner = ternary();
				expect(")");
				return inner;
			}
			if (t.text.equals("["))
				throw new ExpressionTypeException("Array literals can only be assigned as a whole: " + source);
			break;
		default:
			break;
		}
		throw new ExpressionSyntaxException("Unexpected " + t + " at position " + t.position, source);
	}

	private Expression postfix() {
		Expression cur = primary();
		if (strings.containsKey(cur))
			return cur;
		while (true) {
			if (accept(".")) {
				Token prop = next();
				if (prop.type == TokenType.NUMBER && prop.value instanceof Long
				    && cur instanceof VariableExpression)
				{
					cur = new VariableExpression(((VariableExpression)cur).variable + "." + prop.text);
					continue;
				}
				if (prop.type != TokenType.IDENTIFIER)
					throw new ExpressionSyntaxException("Expected a property name after '.', found " + prop, source);
				if (prop.text.equals(LENGTH_PROPERTY)) {
					cur = lengthOf(cur);
				} else if (cur instanceof VariableExpression) {
					cur = new VariableExpression(((VariableExpression)cur).variable + "." + prop.text);
				} else {
					throw new UnsupportedConstructException("Only identifiers can be accessed through dot notation: " + source);
				}
			} else if (accept("[")) {
				Expression index = ternary();
				expect("]");
				cur = new OperatorExpression(Operator.ARRAY_ACCESS, cur, index);
			} else if (peek().is("(")) {
				cur = call(cur);
			} else {
				break;
			}
		}
		if (cur instanceof VariableExpression) {
			String name = ((VariableExpression)cur).variable;
			if (name.equals(MATH_PREFIX + "PI"))
				return ConstantExpression.PI;
			if (name.equals(MATH_PREFIX + "E"))
				return ConstantExpression.E;
		}
		return cur;
	}

	/**
	 * The expression for the length of an array: its length
	 * variable if it is an identifier, or the length variable of
	 * the next dimension indexed the same way if it is an array
	 * access, so that a[i].length refers to a.d2_len[i].
	 */
	public static Expression lengthOf(Expression array) {
		if (array instanceof VariableExpression)
			return new VariableExpression(lengthVariable(((VariableExpression)array).variable, 1));
		if (array instanceof OperatorExpression
		    && ((OperatorExpression)array).op == Operator.ARRAY_ACCESS)
		{
			return accessToLength((OperatorExpression)array, 1);
		}
		throw new UnsupportedConstructException("Cannot take the length of " + array);
	}

	private static Expression accessToLength(OperatorExpression access, int level) {
		int dim = level + 1;
		Expression array = access.getOperand("exp");
		Expression index = access.getOperand("index");
		if (array instanceof VariableExpression) {
			String name = ((VariableExpression)array).variable;
			return new OperatorExpression(Operator.ARRAY_ACCESS,
					new VariableExpression(lengthVariable(name, dim)),
					index);
		}
		if (array instanceof OperatorExpression
		    && ((OperatorExpression)array).op == Operator.ARRAY_ACCESS)
		{
			return new OperatorExpression(Operator.ARRAY_ACCESS,
					accessToLength((OperatorExpression)array, dim),
					index);
		}
		throw new UnsupportedConstructException("Cannot take the length of " + access);
	}

	private Expression call(Expression callee) {
		expect("(");
		ArrayList<Expression> args = new ArrayList<>();
		if (!accept(")")) {
			do {
				args.add(ternary());
			} while (accept(","));
			expect(")");
		}
		if (!(callee instanceof VariableExpression))
			throw new UnsupportedConstructException("Only named functions can be called: " + source);
		String name = ((VariableExpression)callee).variable;
		if (name.startsWith(MATH_PREFIX))
			return mathCall(name.substring(MATH_PREFIX.length()), args);
		for (Operator op : Operator.values()) {
			if (op.macro && op.symbol.equals(name))
				return macroCall(op, args);
		}
		throw new UnsupportedConstructException("Unsupported function call " + name + ": " + source);
	}

	private Expression mathCall(String function, List<Expression> args) {
		Operator op;
		switch (function) {
		case "abs": op = Operator.ABS; break;
		case "floor": op = Operator.FLOOR; break;
		case "ceil": op = Operator.CEIL; break;
		case "cos": op = Operator.COS; break;
		case "sin": op = Operator.SIN; break;
		case "log": op = Operator.LOG; break;
		case "pow": op = Operator.POW; break;
		case "min": op = Operator.MIN; break;
		case "max": op = Operator.MAX; break;
		case "random":
			checkArguments("Math.random", 0, args);
			return DistributionExpression.uniform(0.0, 1.0);
		default:
			throw new UnsupportedConstructException("Unsupported function Math." + function + ": " + source);
		}
		checkArguments("Math." + function, op.operands.size(), args);
		return new OperatorExpression(op, args.toArray(new Expression[0]));
	}

	private Expression macroCall(Operator op, List<Expression> args) {
		checkArguments(op.symbol, op.operands.size(), args);
		Expression[] operands = new Expression[args.size()];
		for (int i = 0; i < operands.length; i++) {
			Expression arg = args.get(i);
			String s = strings.remove(arg);
			operands[i] = s != null ? new VariableExpression(s) : arg;
		}
		return new OperatorExpression(op, operands);
	}

	private void checkArguments(String function, int expected, List<Expression> args) {
		if (args.size() != expected)
			throw new UnsupportedConstructException(function + " takes " + expected + " arguments, found " + args.size() + ": " + source);
	}

	/**
	 * Read an array literal, nested for each dimension. If the base
	 * type is null it is inferred from the elements; if dims is
	 * negative the nesting depth is free but must be uniform.
	 */
	private ArrayValueExpression arrayLiteral(JaniBaseType base, int dims) {
		expect("[");
		ArrayList<Expression> elements = new ArrayList<>();
		if (!accept("]")) {
			do {
				if (peek().is("[")) {
					if (dims == 1)
						throw new ExpressionTypeException("Too many array dimensions in " + source);
					elements.add(arrayLiteral(base, dims - 1));
				} else {
					if (dims > 1)
						throw new ExpressionTypeException("Expected a nested array literal in " + source);
					elements.add(arrayElement(base));
				}
			} while (accept(","));
			expect("]");
		}
		checkUniform(elements);
		if (base == null && isReal(elements))
			return (ArrayValueExpression)toReal(new ArrayValueExpression(elements));
		return new ArrayValueExpression(elements);
	}

	private Expression arrayElement(JaniBaseType base) {
		boolean negative = accept("-");
		Token t = next();
		if (t.type != TokenType.NUMBER)
			throw new ExpressionTypeException("Array elements must be numeric literals, found " + t + " in " + source);
		Object v = negative ? negate(t).value : literal(t);
		if (base == JaniBaseType.REAL)
			return new ConstantExpression(((Number)v).doubleValue());
		if (base == JaniBaseType.INTEGER && v instanceof Double) {
			double d = (Double)v;
			if (Math.floor(d) != d)
				throw new ExpressionTypeException("Value " + d + " in integer array: " + source);
			return new ConstantExpression((long)d);
		}
		return new ConstantExpression((Number)v);
	}

	private void checkUniform(List<Expression> elements) {
		if (elements.isEmpty())
			return;
		boolean nested = elements.get(0) instanceof ArrayValueExpression;
		for (Expression e : elements) {
			if ((e instanceof ArrayValueExpression) != nested)
				throw new ExpressionTypeException("Array literal mixes arrays and scalars: " + source);
		}
	}

	private static boolean isReal(List<Expression> elements) {
		for (Expression e : elements) {
			if (e instanceof ArrayValueExpression) {
				if (isReal(((ArrayValueExpression)e).elements))
					return true;
			} else if (((ConstantExpression)e).isReal()) {
				return true;
			}
		}
		return false;
	}

	private static Expression toReal(Expression e) {
		if (e instanceof ArrayValueExpression)
			return e.mapChildren(ExpressionParser::toReal);
		return new ConstantExpression(((ConstantExpression)e).numberValue().doubleValue());
	}

	private static ArrayValueExpression padDeep(ArrayValueExpression literal, ArrayInfo shape) {
		ArrayInfo in = shape.inner();
		if (in == null)
			return shape.pad(literal.elements);
		ArrayList<Expression> rows = new ArrayList<>();
		for (Expression row : literal.elements)
			rows.add(padDeep((ArrayValueExpression)row, in));
		return shape.pad(rows);
	}
}
