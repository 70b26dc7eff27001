package org.lokray.kernelc;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.lokray.kernelc.dto.TranslationDTO;
import org.lokray.kernelc.util.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line driver. Translates each input file as a module and writes the result next
 * to it with the {@code .okl} extension.
 */
public class Main
{
	public static final String VERSION = "0.1.0-alpha";
	public static final String OUTPUT_EXTENSION = ".okl";

	public static void main(String[] args)
	{
		int status = run(args);
		if (status != 0)
		{
			System.exit(status);
		}
	}

	/**
	 * @return The process exit status: 0 if every file translated, 1 otherwise.
	 */
	public static int run(String[] args)
	{
		try
		{
			CompilerArguments arguments = CompilerArguments.parse(args);

			if (arguments.isHelpFlag())
			{
				CompilerArguments.printUsage();
				return 0;
			}
			if (arguments.isVersionFlag())
			{
				System.out.println("kernelc (OKL kernel translator) version " + VERSION);
				return 0;
			}

			if (arguments.getInputFiles().isEmpty())
			{
				throw new IllegalArgumentException("No input files provided. Use -h for help.");
			}

			if (arguments.isCheckOnly() && arguments.getOutputPath() != null)
			{
				Debug.logWarning("Ignoring output path in check mode: " + arguments.getOutputPath());
			}

			if (!validatePaths(arguments))
			{
				Debug.logError("Aborting.");
				return 1;
			}

			return translateFiles(arguments);
		}
		catch (IllegalArgumentException e)
		{
			Debug.logError("Translator initialization failed: " + e.getMessage());
		}
		catch (IOException e)
		{
			Debug.logError("Error writing file: " + e.getMessage());
		}
		return 1;
	}

	private static int translateFiles(CompilerArguments args) throws IOException
	{
		KernelTranslator translator = new KernelTranslator();
		List<TranslationDTO> report = new ArrayList<>();
		boolean failed = false;

		for (Path file : args.getInputFiles())
		{
			TranslationDTO entry = new TranslationDTO();
			entry.file = file.toString();
			report.add(entry);

			try
			{
				String source = FileUtils.load(file);
				TranslationResult result = translator.translateSource(source, file.getFileName().toString());
				entry.success = true;
				entry.output = result.text();

				if (args.isCheckOnly())
				{
					Debug.logInfo("Translation check passed: " + file);
					continue;
				}

				Path outputFile = getOutputPath(args, file);
				Path parent = outputFile.toAbsolutePath().getParent();
				if (parent != null)
				{
					Files.createDirectories(parent);
				}
				Files.writeString(outputFile, result.text() + "\n", StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
				Debug.logInfo("Wrote kernel to: " + outputFile);
			}
			catch (TranslationException e)
			{
				failed = true;
				entry.error = e.getDiagnostic().message();
				entry.line = e.getDiagnostic().line();
				entry.column = e.getDiagnostic().column();
				Debug.logError(file + ":\n" + e.getMessage());
			}
			catch (KernelcException e)
			{
				failed = true;
				entry.error = e.getMessage();
				Debug.logError(file + ": " + e.getMessage());
			}
			catch (IOException e)
			{
				failed = true;
				entry.error = e.getMessage();
				Debug.logError("Error reading file " + file + ": " + e.getMessage());
			}
		}

		if (args.getJsonReportPath() != null)
		{
			writeReport(report, args.getJsonReportPath());
		}
		return failed ? 1 : 0;
	}

	private static void writeReport(List<TranslationDTO> report, Path outPath) throws IOException
	{
		Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
		Path parent = outPath.toAbsolutePath().getParent();
		if (parent != null)
		{
			Files.createDirectories(parent);
		}
		Files.writeString(outPath, gson.toJson(report), StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
		Debug.logInfo("Wrote translation report to: " + outPath);
	}

	/**
	 * The explicit output path if one was given, else the input path with the kernel extension.
	 */
	static Path getOutputPath(CompilerArguments args, Path inputFile)
	{
		if (args.getOutputPath() != null)
		{
			return args.getOutputPath();
		}
		return FileUtils.withExtension(inputFile, OUTPUT_EXTENSION);
	}

	private static boolean validatePaths(CompilerArguments args)
	{
		boolean valid = true;
		for (Path input : args.getInputFiles())
		{
			if (!Files.isRegularFile(input))
			{
				Debug.logError("Input file not found: " + input);
				valid = false;
			}
		}
		return valid;
	}
}
