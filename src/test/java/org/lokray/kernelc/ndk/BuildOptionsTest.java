package org.lokray.kernelc.ndk;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class BuildOptionsTest
{
	@Test
	void serializesDefinesAndFlags()
	{
		BuildOptions options = BuildOptions.none()
				.define("TILE", 16)
				.define("SCALE", 0.5)
				.flag("-O3")
				.flag("--mode", "CUDA");

		JsonObject json = JsonParser.parseString(options.toJson()).getAsJsonObject();

		assertEquals("16", json.getAsJsonObject("defines").get("TILE").getAsString());
		assertEquals("0.5", json.getAsJsonObject("defines").get("SCALE").getAsString());
		assertEquals("", json.getAsJsonObject("flags").get("-O3").getAsString());
		assertEquals("CUDA", json.getAsJsonObject("flags").get("--mode").getAsString());
	}

	@Test
	void readsBackInInsertionOrder()
	{
		BuildOptions options = BuildOptions.fromJson("{\"defines\": {\"B\": \"2\", \"A\": \"1\"}, \"flags\": {\"-g\": \"\"}}");

		assertEquals(List.of("B", "A"), List.copyOf(options.getDefines().keySet()));
		assertEquals(Map.of("-g", ""), options.getFlags());
	}

	@Test
	void missingSectionsAreEmpty()
	{
		for (BuildOptions options : List.of(BuildOptions.fromJson("{}"), BuildOptions.fromJson(""), BuildOptions.none()))
		{
			assertTrue(options.getDefines().isEmpty());
			assertTrue(options.getFlags().isEmpty());
		}
	}

	@Test
	void optionMapsAreReadOnly()
	{
		BuildOptions options = BuildOptions.none().define("N", 1);

		assertThrows(UnsupportedOperationException.class, () -> options.getDefines().put("M", "2"));
	}
}
