package org.lokray.kernelc;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.lokray.kernelc.util.CompilerArguments;
import org.lokray.kernelc.util.Debug;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class MainTest
{
	private static final String ADD = "def add(a: int, b: int) -> int:\n    return a + b\n";
	private static final String BROKEN = "def bad(x: int) -> int:\n    return abs(x)\n";

	@TempDir
	Path dir;

	@AfterEach
	void resetDebug()
	{
		Debug.ENABLE_DEBUG = false;
	}

	private Path write(String name, String content) throws IOException
	{
		Path file = dir.resolve(name);
		Files.writeString(file, content);
		return file;
	}

	@Test
	void writesKernelNextToTheInput() throws IOException
	{
		Path input = write("add.py", ADD);

		assertEquals(0, Main.run(new String[]{input.toString()}));
		assertEquals("int add(int a,\n        int b) {\n  return a + b;\n}\n", Files.readString(dir.resolve("add.okl")));
	}

	@Test
	void writesToExplicitOutput() throws IOException
	{
		Path input = write("add.py", ADD);
		Path output = dir.resolve("build").resolve("kernel.okl");

		assertEquals(0, Main.run(new String[]{"-o", output.toString(), input.toString()}));
		assertTrue(Files.exists(output));
		assertFalse(Files.exists(dir.resolve("add.okl")));
	}

	@Test
	void checkOnlyWritesNothing() throws IOException
	{
		Path input = write("add.py", ADD);

		assertEquals(0, Main.run(new String[]{"--check", input.toString()}));
		assertFalse(Files.exists(dir.resolve("add.okl")));
	}

	@Test
	void failureExitsWithOneAndKeepsGoing() throws IOException
	{
		Path broken = write("bad.py", BROKEN);
		Path good = write("add.py", ADD);

		assertEquals(1, Main.run(new String[]{broken.toString(), good.toString()}));
		assertFalse(Files.exists(dir.resolve("bad.okl")));
		assertTrue(Files.exists(dir.resolve("add.okl")));
	}

	@Test
	void reportsEveryFileAsJson() throws IOException
	{
		Path good = write("add.py", ADD);
		Path broken = write("bad.py", BROKEN);
		Path report = dir.resolve("report.json");

		Main.run(new String[]{"-k", "--json", report.toString(), good.toString(), broken.toString()});

		JsonArray entries = JsonParser.parseString(Files.readString(report)).getAsJsonArray();
		assertEquals(2, entries.size());

		JsonObject success = entries.get(0).getAsJsonObject();
		assertTrue(success.get("success").getAsBoolean());
		assertEquals(good.toString(), success.get("file").getAsString());
		assertTrue(success.get("output").getAsString().startsWith("int add(int a,"));

		JsonObject failure = entries.get(1).getAsJsonObject();
		assertFalse(failure.get("success").getAsBoolean());
		assertEquals("Undefined name: abs", failure.get("error").getAsString());
		assertEquals(2, failure.get("line").getAsInt());
		assertEquals(11, failure.get("column").getAsInt());
	}

	@Test
	void missingInputFails()
	{
		assertEquals(1, Main.run(new String[]{dir.resolve("missing.py").toString()}));
	}

	@Test
	void helpAndVersionSucceed()
	{
		assertEquals(0, Main.run(new String[]{"--help"}));
		assertEquals(0, Main.run(new String[]{"--version"}));
	}

	@Test
	void outputPathDefaultsToKernelExtension()
	{
		CompilerArguments args = CompilerArguments.parse(new String[]{"src/add.py"});

		assertEquals(Path.of("src", "add.okl"), Main.getOutputPath(args, Path.of("src", "add.py")));
	}
}
