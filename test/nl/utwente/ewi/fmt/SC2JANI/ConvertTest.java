package nl.utwente.ewi.fmt.SC2JANI;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import nl.ennoruijters.util.JSONParser;

import static org.junit.jupiter.api.Assertions.*;

public class ConvertTest
{
	private static final String PING = ModelDescriptorTest.resource("ping/ping.json");

	@Test
	void convertsPingModel(@TempDir Path dir) throws IOException {
		Path out = dir.resolve("ping.jani");
		int ret = Convert.run(new String[] {"--jani", "-o", out.toString(),
		                                    "--def", "limit", "2",
		                                    "--random-options", "3", PING});
		assertEquals(0, ret);
		Object json = JSONParser.readJsonFromFile(out.toString());
		assertTrue(json instanceof Map);
		Map<?, ?> root = (Map<?, ?>)json;
		assertEquals("ping", root.get("name"));
		assertEquals(1L, root.get("jani-version"));
		assertEquals(3, ((Object[])root.get("automata")).length);
		assertEquals(1, ((Object[])root.get("properties")).length);
		Object[] constants = (Object[])root.get("constants");
		Map<?, ?> limit = (Map<?, ?>)constants[0];
		assertEquals("limit", limit.get("name"));
		assertEquals(2L, limit.get("value"));
	}

	@Test
	void usage() {
		assertEquals(0, Convert.run(new String[] {"-h"}));
		assertEquals(1, Convert.run(new String[0]));
		assertEquals(1, Convert.run(new String[] {"--scxml", PING}));
		assertEquals(1, Convert.run(new String[] {"--jani"}));
		assertEquals(1, Convert.run(new String[] {"--jani", "--verbose", PING}));
	}

	@Test
	void errors(@TempDir Path dir) throws IOException {
		String out = dir.resolve("x.jani").toString();
		assertEquals(2, Convert.run(new String[] {"--jani", "-o", out, "--def", "nope", "1", PING}));
		assertEquals(2, Convert.run(new String[] {"--jani", "-o", out, "--max-array-size", "many", PING}));
		assertEquals(2, Convert.run(new String[] {"--jani", "-o", PING}));
		assertFalse(Files.exists(dir.resolve("x.jani")));
		assertEquals(3, Convert.run(new String[] {"--jani", "-o", out, dir.resolve("missing.json").toString()}));

		Path bad = dir.resolve("bad.json");
		Files.write(bad, "{\"name\": \"bad\", \"statecharts\": [\"nowhere.json\"]}".getBytes(StandardCharsets.UTF_8));
		assertEquals(3, Convert.run(new String[] {"--jani", "-o", out, bad.toString()}));
	}
}
