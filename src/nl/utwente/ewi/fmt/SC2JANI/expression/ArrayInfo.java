package nl.utwente.ewi.fmt.SC2JANI.expression;

import java.util.ArrayList;
import java.util.List;

import nl.utwente.ewi.fmt.SC2JANI.ExpressionTypeException;
import nl.utwente.ewi.fmt.SC2JANI.JaniModel.JaniBaseType;

/**
 * Shape of a fixed-capacity array: the element type and the maximum
 * size of each dimension.
 */
public class ArrayInfo
{
	public static final String ITERATOR_PREFIX = "__array_iterator_dim_";

	public final JaniBaseType base;
	public final List<Integer> maxSizes;

	public ArrayInfo(JaniBaseType base, List<Integer> maxSizes)
	{
		if (base == JaniBaseType.BOOLEAN)
			throw new IllegalArgumentException("Arrays of booleans are not supported");
		if (maxSizes.isEmpty())
			throw new IllegalArgumentException("Arrays need at least one dimension");
		for (Integer size : maxSizes) {
			if (size == null || size <= 0)
				throw new IllegalArgumentException("Invalid array sizes: " + maxSizes);
		}
		this.base = base;
		this.maxSizes = List.copyOf(maxSizes);
	}

	public ArrayInfo(JaniBaseType base, int... maxSizes)
	{
		this(base, toList(maxSizes));
	}

	private static List<Integer> toList(int[] sizes) {
		ArrayList<Integer> ret = new ArrayList<>();
		for (int s : sizes)
			ret.add(s);
		return ret;
	}

	public int dimensions() {
		return maxSizes.size();
	}

	/** The shape of one element of this array, or null if the
	 * elements are scalars.
	 */
	public ArrayInfo inner() {
		if (maxSizes.size() == 1)
			return null;
		return new ArrayInfo(base, maxSizes.subList(1, maxSizes.size()));
	}

	public ConstantExpression zero() {
		if (base == JaniBaseType.REAL)
			return new ConstantExpression(0.0);
		return ConstantExpression.ZERO;
	}

	/** The initial value of an array variable without an explicit
	 * initializer: nested "ac" expressions filling every dimension
	 * with zeroes.
	 */
	public Expression defaultValue() {
		return defaultValue(1);
	}

	private Expression defaultValue(int dim) {
		ArrayInfo in = inner();
		Expression elem = in == null ? zero() : in.defaultValue(dim + 1);
		return new OperatorExpression(Operator.ARRAY_CONSTRUCTOR,
				new VariableExpression(ITERATOR_PREFIX + dim),
				new ConstantExpression((long)maxSizes.get(0)),
				elem);
	}

	/** An array literal of this shape, filled with zeroes. */
	public ArrayValueExpression zeroArray() {
		return pad(List.of());
	}

	/** Pad the elements to the maximum size of the first dimension.
	 * Elements of nested arrays must already be padded.
	 */
	public ArrayValueExpression pad(List<? extends Expression> elements) {
		int size = maxSizes.get(0);
		if (elements.size() > size)
			throw new ExpressionTypeException("Array of " + elements.size() + " elements exceeds maximum size " + size);
		ArrayList<Expression> ret = new ArrayList<>(elements);
		ArrayInfo in = inner();
		while (ret.size() < size)
			ret.add(in == null ? zero() : in.zeroArray());
		return new ArrayValueExpression(ret);
	}

	/**
	 * Initial value of the length variable of the given dimension
	 * (counting from 1) for an array initialized with the literal.
	 * The first dimension has a scalar length; the lengths of
	 * dimension k form an array with k-1 dimensions, one entry per
	 * row of the previous dimensions.
	 *
	 * @param literal The unpadded initializer, or null if the
	 * array starts out empty.
	 */
	public Expression lengthValue(int dimension, ArrayValueExpression literal) {
		if (dimension < 1 || dimension > dimensions())
			throw new IllegalArgumentException("Array " + this + " has no dimension " + dimension);
		if (dimension == 1)
			return new ConstantExpression(literal == null ? 0L : (long)literal.length());
		if (literal == null)
			return lengthShape(dimension).defaultValue();
		return lengths(literal, dimension - 1, 0);
	}

	/** The shape of the length variable of the given dimension,
	 * or null if it is a scalar. */
	public ArrayInfo lengthShape(int dimension) {
		if (dimension <= 1)
			return null;
		return new ArrayInfo(JaniBaseType.INTEGER, maxSizes.subList(0, dimension - 1));
	}

	private Expression lengths(Expression node, int depth, int dim) {
		if (depth == 0) {
			long len = node == null ? 0 : ((ArrayValueExpression)node).length();
			return new ConstantExpression(len);
		}
		List<Expression> elements = node == null ? List.of() : ((ArrayValueExpression)node).elements;
		ArrayList<Expression> ret = new ArrayList<>();
		for (int i = 0; i < maxSizes.get(dim); i++) {
			Expression child = i < elements.size() ? elements.get(i) : null;
			ret.add(lengths(child, depth - 1, dim + 1));
		}
		return new ArrayValueExpression(ret);
	}

	public String toString() {
		StringBuilder ret = new StringBuilder(base.toString().toLowerCase());
		for (Integer s : maxSizes)
			ret.append('[').append(s).append(']');
		return ret.toString();
	}
}
