package nl.utwente.ewi.fmt.SC2JANI;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Settings of a conversion. Options not set explicitly (on the
 * command line) are taken from the model descriptor, and otherwise
 * get their default value.
 */
public class ConversionOptions
{
	public static final int DEFAULT_MAX_ARRAY_SIZE = 100;
	public static final int DEFAULT_RANDOM_OPTIONS = 100;

	private Integer maxArraySize;
	private Integer randomOptions;
	private String output;
	private final TreeMap<String, Object> constants = new TreeMap<>();

	public void setMaxArraySize(int size) {
		if (size < 1)
			throw new ConfigurationException("Maximum array size should be positive, not " + size);
		maxArraySize = size;
	}

	public void setRandomOptions(int options) {
		if (options < 1)
			throw new ConfigurationException("Number of random options should be positive, not " + options);
		randomOptions = options;
	}

	public void setOutput(String output) {
		this.output = output;
	}

	/** Override the value of a model constant.
	 * @param value A Long, Double or Boolean.
	 */
	public void defineConstant(String name, Object value) {
		if (!(value instanceof Long || value instanceof Double || value instanceof Boolean))
			throw new ConfigurationException("Unsupported value " + value + " for constant " + name);
		constants.put(name, value);
	}

	/** Parse a constant value given as text: true, false, or a
	 * number. */
	public static Object parseValue(String v) {
		if (v.equalsIgnoreCase("true"))
			return Boolean.TRUE;
		if (v.equalsIgnoreCase("false"))
			return Boolean.FALSE;
		try {
			return Long.valueOf(v);
		} catch (NumberFormatException e) {
			try {
				return Double.valueOf(v);
			} catch (NumberFormatException e2) {
				throw new ConfigurationException("Unable to parse value: " + v);
			}
		}
	}

	/** The maximum array size, falling back to the given value
	 * (if not null) or the default. */
	public int getMaxArraySize(Number fallback) {
		if (maxArraySize != null)
			return maxArraySize;
		if (fallback != null)
			return positive(fallback, "max_array_size");
		return DEFAULT_MAX_ARRAY_SIZE;
	}

	public int getRandomOptions(Number fallback) {
		if (randomOptions != null)
			return randomOptions;
		if (fallback != null)
			return positive(fallback, "random_options");
		return DEFAULT_RANDOM_OPTIONS;
	}

	private static int positive(Number n, String what) {
		int ret;
		try {
			ret = JaniUtils.safeToInteger(n);
		} catch (ArithmeticException e) {
			throw new ConfigurationException("Invalid " + what + ": " + e.getMessage());
		}
		if (ret < 1)
			throw new ConfigurationException(what + " should be positive, not " + ret);
		return ret;
	}

	/** The output file, or the given default if not set. */
	public String getOutput(String fallback) {
		return output == null ? fallback : output;
	}

	public Map<String, Object> getConstants() {
		return Collections.unmodifiableMap(constants);
	}
}
