package org.lokray.kernelc.ndk;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ProcessKernelBuildServiceTest
{
	@TempDir
	Path buildDir;

	@Test
	void appendsKernelArgumentsToTheCommand()
	{
		ProcessKernelBuildService service = new ProcessKernelBuildService(buildDir, List.of("occa", "compile"));

		List<String> command = service.buildCommand(buildDir.resolve("add.okl"), "add",
				buildDir.resolve("add.json"), buildDir.resolve("add.bin"));

		assertEquals(List.of("occa", "compile",
				buildDir.resolve("add.okl").toAbsolutePath().toString(),
				"--kernel", "add",
				"--props", buildDir.resolve("add.json").toAbsolutePath().toString(),
				"-o", buildDir.resolve("add.bin").toAbsolutePath().toString()), command);
	}

	@Test
	void rejectsEmptyCommand()
	{
		assertThrows(IllegalArgumentException.class, () -> new ProcessKernelBuildService(buildDir, List.of()));
	}

	@Test
	@EnabledOnOs({OS.LINUX, OS.MAC})
	void writesKernelAndPropertiesBeforeBuilding() throws Exception
	{
		ProcessKernelBuildService service = new ProcessKernelBuildService(buildDir.resolve("out"), List.of("true"));

		KernelHandle handle = service.build("@kernel void add() {}", "add", BuildOptions.none().define("N", 4));

		assertEquals("add", handle.entryPoint());
		assertEquals("@kernel void add() {}", Files.readString(handle.kernelFile()));
		assertTrue(Files.readString(handle.propertiesFile()).contains("\"N\": \"4\""));
		assertEquals(buildDir.resolve("out").resolve("add.bin"), handle.binary());
	}

	@Test
	@EnabledOnOs({OS.LINUX, OS.MAC})
	void failingCommandFailsTheBuild()
	{
		ProcessKernelBuildService service = new ProcessKernelBuildService(buildDir, List.of("false"));

		RuntimeException error = assertThrows(RuntimeException.class,
				() -> service.build("@kernel void add() {}", "add", BuildOptions.none()));
		assertTrue(error.getMessage().startsWith("Command failed with exit code 1"));
	}
}
