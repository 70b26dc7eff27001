package org.lokray.kernelc.ast;

/**
 * Location of a node in its source text: 1-based line, 0-based column.
 */
public record SourcePosition(int line, int column)
{
	public static final SourcePosition UNKNOWN = new SourcePosition(0, 0);

	public static SourcePosition of(int line, int column)
	{
		return new SourcePosition(line, column);
	}

	public boolean isKnown()
	{
		return line > 0;
	}

	@Override
	public String toString()
	{
		return isKnown() ? line + ":" + column : "<unknown>";
	}
}
