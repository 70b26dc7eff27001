package org.lokray.kernelc.util;

import org.lokray.kernelc.ast.SourcePosition;
import org.lokray.kernelc.ast.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds diagnostics against one source text. Translation stops at the first error, so
 * there is exactly one diagnostic per failed run.
 */
public class ErrorReporter
{
	private static final int CONTEXT_LINES = 2;
	private static final String PREFIX = "   ";

	// Per thread: the exception is the authoritative result
	private static final ThreadLocal<SyntaxNode> LAST_ERROR_NODE = new ThreadLocal<>();

	private final String source;

	/**
	 * @param source The text the tree was parsed from, or null for hand-built trees.
	 */
	public ErrorReporter(String source)
	{
		this.source = source;
	}

	/**
	 * @return The node of the most recent failure on this thread.
	 */
	public static Optional<SyntaxNode> getLastErrorNode()
	{
		return Optional.ofNullable(LAST_ERROR_NODE.get());
	}

	public static void clearLastErrorNode()
	{
		LAST_ERROR_NODE.remove();
	}

	/**
	 * Creates the exception for a failing node. Callers throw the result.
	 */
	public TranslationException error(SyntaxNode node, String message)
	{
		LAST_ERROR_NODE.set(node);
		Diagnostic diagnostic = diagnose(node.position(), message);
		Debug.logDebug("Translation failed at " + node.position() + ": " + message);
		return new TranslationException(diagnostic, node);
	}

	/**
	 * Creates the exception for a failure that has a position but no node (syntax errors).
	 */
	public TranslationException error(SourcePosition position, String message)
	{
		Diagnostic diagnostic = diagnose(position, message);
		Debug.logDebug("Translation failed at " + position + ": " + message);
		return new TranslationException(diagnostic, null);
	}

	public Diagnostic diagnose(SourcePosition position, String message)
	{
		return new Diagnostic(position.line(), position.column(), message, renderContext(position));
	}

	private String renderContext(SourcePosition position)
	{
		if (source == null || !position.isKnown())
		{
			return "";
		}

		List<String> sourceLines = source.lines().toList();
		int errorLine = position.line() - 1;

		List<Integer> lines = new ArrayList<>();
		for (int line = errorLine - CONTEXT_LINES; line <= errorLine + CONTEXT_LINES; line++)
		{
			if (line >= 0 && line < sourceLines.size())
			{
				lines.add(line);
			}
		}
		if (lines.isEmpty())
		{
			return "";
		}

		int labelWidth = lines.stream()
				.mapToInt(line -> String.valueOf(line + 1).length())
				.max()
				.orElse(1);

		StringBuilder context = new StringBuilder();
		for (int line : lines)
		{
			context.append(PREFIX)
					.append(padRight(String.valueOf(line + 1), labelWidth))
					.append(" | ")
					.append(sourceLines.get(line))
					.append('\n');
			if (line == errorLine)
			{
				context.append(PREFIX)
						.append(" ".repeat(labelWidth))
						.append(" | ")
						.append(" ".repeat(position.column()))
						.append("^\n");
			}
		}
		return context.toString();
	}

	private static String padRight(String text, int width)
	{
		return text + " ".repeat(Math.max(0, width - text.length()));
	}
}
