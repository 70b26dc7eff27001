package org.lokray.kernelc.codegen;

/**
 * Start, end and step of a counted loop.
 */
public record LoopBounds(String start, String end, long step)
{
	/**
	 * Emitted for every counted loop until bound expressions are evaluated.
	 */
	public static final LoopBounds PLACEHOLDER = new LoopBounds("0", "10", 1);
}
