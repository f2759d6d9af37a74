package nl.utwente.ewi.fmt.SC2JANI;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ConversionOptionsTest
{
	@Test
	void parseValue() {
		assertEquals(Boolean.TRUE, ConversionOptions.parseValue("true"));
		assertEquals(Boolean.FALSE, ConversionOptions.parseValue("FALSE"));
		assertEquals(Long.valueOf(-12), ConversionOptions.parseValue("-12"));
		assertEquals(Double.valueOf(0.25), ConversionOptions.parseValue("0.25"));
		assertEquals(Double.valueOf(1e3), ConversionOptions.parseValue("1e3"));
		assertThrows(ConfigurationException.class, () -> ConversionOptions.parseValue("maybe"));
	}

	@Test
	void fallbacks() {
		ConversionOptions o = new ConversionOptions();
		assertEquals(ConversionOptions.DEFAULT_MAX_ARRAY_SIZE, o.getMaxArraySize(null));
		assertEquals(100, o.getRandomOptions(null));
		assertEquals(7, o.getMaxArraySize(7L));
		assertEquals(3, o.getRandomOptions(3.0));
		o.setMaxArraySize(5);
		assertEquals(5, o.getMaxArraySize(7L));
		assertEquals("m.jani", o.getOutput("m.jani"));
		o.setOutput("out.jani");
		assertEquals("out.jani", o.getOutput("m.jani"));
	}

	@Test
	void invalidValues() {
		ConversionOptions o = new ConversionOptions();
		assertThrows(ConfigurationException.class, () -> o.setMaxArraySize(0));
		assertThrows(ConfigurationException.class, () -> o.setRandomOptions(-1));
		assertThrows(ConfigurationException.class, () -> o.getMaxArraySize(0L));
		assertThrows(ConfigurationException.class, () -> o.getRandomOptions(2.5));
		assertThrows(ConfigurationException.class, () -> o.defineConstant("c", "text"));
	}

	@Test
	void constants() {
		ConversionOptions o = new ConversionOptions();
		o.defineConstant("b", true);
		o.defineConstant("a", 2L);
		o.defineConstant("a", 3L);
		assertEquals(2, o.getConstants().size());
		assertEquals(3L, o.getConstants().get("a"));
		assertThrows(UnsupportedOperationException.class, () -> o.getConstants().put("c", 1L));
	}
}
