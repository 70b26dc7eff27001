package org.lokray.kernelc.parser;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.lokray.kernelc.ast.SourceModule;
import org.lokray.kernelc.util.Debug;
import org.lokray.kernelc.util.ErrorReporter;

import java.util.List;

/**
 * Turns kernel source text into a {@link SourceModule}.
 */
public class SourceParser
{
	/**
	 * Removes the indentation shared by all non-blank lines and makes sure the text ends
	 * with a line break, so that functions cut out of an indented file parse as top-level code.
	 */
	public static String normalize(String source)
	{
		List<String> lines = source.lines().toList();
		int common = Integer.MAX_VALUE;
		for (String line : lines)
		{
			if (!line.isBlank())
			{
				common = Math.min(common, leadingWhitespace(line));
			}
		}
		if (common == Integer.MAX_VALUE)
		{
			common = 0;
		}

		StringBuilder normalized = new StringBuilder();
		for (String line : lines)
		{
			normalized.append(line.isBlank() ? "" : line.substring(common)).append('\n');
		}
		return normalized.toString();
	}

	private static int leadingWhitespace(String line)
	{
		int count = 0;
		while (count < line.length() && (line.charAt(count) == ' ' || line.charAt(count) == '\t'))
		{
			count++;
		}
		return count;
	}

	/**
	 * Parses already normalized source.
	 *
	 * @param source        Source text as returned by {@link #normalize(String)}.
	 * @param sourceName    Name of the source, for log output.
	 * @param errorReporter Reporter bound to {@code source}.
	 * @throws org.lokray.kernelc.util.TranslationException on the first syntax error.
	 */
	public SourceModule parse(String source, String sourceName, ErrorReporter errorReporter)
	{
		Debug.logDebug("Parsing " + sourceName);

		KernelLexer lexer = new KernelLexer(CharStreams.fromString(source, sourceName));
		SyntaxErrorListener listener = new SyntaxErrorListener(errorReporter);
		lexer.removeErrorListeners();
		lexer.addErrorListener(listener);

		KernelParser parser = new KernelParser(new CommonTokenStream(lexer));
		// Remove default error listeners to use our own
		parser.removeErrorListeners();
		parser.addErrorListener(listener);

		KernelParser.FileInputContext tree = parser.fileInput();
		return new SyntaxTreeBuilder().build(tree);
	}
}
