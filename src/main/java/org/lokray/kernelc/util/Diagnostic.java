package org.lokray.kernelc.util;

/**
 * A single translation failure.
 *
 * @param line    1-based line of the offending node, 0 if unknown.
 * @param column  0-based column of the offending node.
 * @param message The bare error message.
 * @param context The rendered source window with a caret line, empty when no source was available.
 */
public record Diagnostic(int line, int column, String message, String context)
{
	public String format()
	{
		return "Error: " + message + "\n" + context;
	}

	@Override
	public String toString()
	{
		return format();
	}
}
