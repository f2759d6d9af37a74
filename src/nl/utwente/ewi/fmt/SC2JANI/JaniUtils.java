package nl.utwente.ewi.fmt.SC2JANI;
import java.util.ArrayList;
import nl.utwente.ewi.fmt.SC2JANI.JaniModel.JaniType;
import nl.utwente.ewi.fmt.SC2JANI.JaniModel.JaniBaseType;

public class JaniUtils {
	public static int safeToInteger(Number num) {
		if (num instanceof Integer)
			return (Integer)num;
		if (num instanceof Long)
			return Math.toIntExact((Long)num);
		if ((num instanceof Float) || (num instanceof Double)) {
			double d = num.doubleValue();
			if (Math.floor(d) != d)
				throw new ArithmeticException(d + " cannot be exactly converted to an integer");
			if (d > Integer.MAX_VALUE || d < Integer.MIN_VALUE)
				throw new ArithmeticException(d + " is too big to be exactly converted to an integer");
			return (int)d;
		}
		throw new UnsupportedOperationException("Cannot convert type " + num.getClass() + " to integer");
	}

	/** Quote a string as a JSON string literal. */
	public static String quote(String s) {
		StringBuilder ret = new StringBuilder("\"");
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			switch (c) {
			case '"': ret.append("\\\""); break;
			case '\\': ret.append("\\\\"); break;
			case '\n': ret.append("\\n"); break;
			case '\r': ret.append("\\r"); break;
			case '\t': ret.append("\\t"); break;
			default:
				if (c < 0x20)
					ret.append(String.format("\\u%04x", (int)c));
				else
					ret.append(c);
			}
		}
		return ret.append('"').toString();
	}

	public static String tabs(int indent) {
		StringBuilder ret = new StringBuilder();
		for (int i = 0; i < indent; i++)
			ret.append('\t');
		return ret.toString();
	}

	/**
	 * Parse a state-chart type name: bool, int (of any width,
	 * signed or not), float/double/real or string, optionally
	 * followed by array dimensions ("int32[5][]"). Strings are
	 * arrays of integers. Dimensions without a size get the
	 * default size.
	 *
	 * @return The type, with the maximum size of each array
	 * dimension.
	 */
	public static JaniType parseType(String t, int defaultSize)
	{
		if (t == null)
			throw new ExpressionTypeException("Missing type");
		String name = t.trim();
		int bracket = name.indexOf('[');
		String base = bracket < 0 ? name : name.substring(0, bracket).trim();
		String dims = bracket < 0 ? "" : name.substring(bracket).replaceAll("\\s", "");
		ArrayList<Integer> parsed = new ArrayList<>();
		while (!dims.isEmpty()) {
			int close = dims.indexOf(']');
			if (dims.charAt(0) != '[' || close < 0)
				throw new ExpressionTypeException("Malformed array type: " + t);
			String size = dims.substring(1, close);
			if (size.isEmpty()) {
				parsed.add(defaultSize);
			} else {
				try {
					parsed.add(Integer.parseInt(size));
				} catch (NumberFormatException e) {
					throw new ExpressionTypeException("Invalid array size '" + size + "' in type " + t);
				}
				if (parsed.get(parsed.size() - 1) <= 0)
					throw new ExpressionTypeException("Array size should be positive in type " + t);
			}
			dims = dims.substring(close + 1);
		}
		JaniBaseType bt;
		if (base.equals("string")) {
			if (!parsed.isEmpty())
				throw new ExpressionTypeException("Arrays of strings are not supported: " + t);
			parsed.add(defaultSize);
			bt = JaniBaseType.INTEGER;
		} else {
			bt = parseBaseType(base);
			if (bt == null)
				throw new ExpressionTypeException("Unknown type: " + t);
			if (bt == JaniBaseType.BOOLEAN && !parsed.isEmpty())
				throw new ExpressionTypeException("Arrays of booleans are not supported: " + t);
		}
		return new JaniType(bt, parsed);
	}

	public static JaniBaseType parseBaseType(String base) {
		switch (base) {
		case "bool":
		case "boolean":
			return JaniBaseType.BOOLEAN;
		case "float":
		case "float32":
		case "float64":
		case "double":
		case "real":
			return JaniBaseType.REAL;
		default:
			if (base.matches("u?int(8|16|32|64)?"))
				return JaniBaseType.INTEGER;
			return null;
		}
	}
}
