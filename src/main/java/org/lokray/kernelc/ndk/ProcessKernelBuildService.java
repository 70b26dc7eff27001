package org.lokray.kernelc.ndk;

import org.lokray.kernelc.util.Debug;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

import static org.lokray.kernelc.util.ProcessUtils.executeCommand;

/**
 * Builds kernels with an external compiler command.
 * <p>
 * The kernel source and its properties are written to the build directory as
 * {@code <entry>.okl} and {@code <entry>.json}, then the command is run as
 * {@code command... <entry>.okl --kernel <entry> --props <entry>.json -o <entry>.bin}.
 */
public class ProcessKernelBuildService implements KernelBuildService
{
	private final Path buildDir;
	private final List<String> command;

	public ProcessKernelBuildService(Path buildDir, List<String> command)
	{
		if (command.isEmpty())
		{
			throw new IllegalArgumentException("Build command must not be empty");
		}
		this.buildDir = buildDir;
		this.command = List.copyOf(command);
	}

	@Override
	public KernelHandle build(String source, String entryPoint, BuildOptions options) throws IOException, InterruptedException
	{
		Files.createDirectories(buildDir);
		Path kernelFile = buildDir.resolve(entryPoint + ".okl");
		Path propertiesFile = buildDir.resolve(entryPoint + ".json");
		Path binary = buildDir.resolve(entryPoint + ".bin");

		Files.writeString(kernelFile, source, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
		Files.writeString(propertiesFile, options.toJson(), StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
		Debug.logDebug("Wrote kernel '" + entryPoint + "' to: " + kernelFile);

		executeCommand(new ProcessBuilder(buildCommand(kernelFile, entryPoint, propertiesFile, binary)));

		Debug.logInfo("Kernel '" + entryPoint + "' built at: " + binary);
		return new KernelHandle(entryPoint, kernelFile, propertiesFile, binary);
	}

	List<String> buildCommand(Path kernelFile, String entryPoint, Path propertiesFile, Path binary)
	{
		List<String> full = new ArrayList<>(command);
		full.add(kernelFile.toAbsolutePath().toString());
		full.add("--kernel");
		full.add(entryPoint);
		full.add("--props");
		full.add(propertiesFile.toAbsolutePath().toString());
		full.add("-o");
		full.add(binary.toAbsolutePath().toString());
		return full;
	}
}
