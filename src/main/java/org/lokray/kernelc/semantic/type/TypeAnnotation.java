package org.lokray.kernelc.semantic.type;

/**
 * A resolved type annotation. Knows how to declare a variable of its type in kernel syntax.
 */
public interface TypeAnnotation
{
	/**
	 * @param variableName The declared name, or an empty string for the bare type.
	 * @return The declaration text, e.g. {@code float *x} or {@code int y[4][4]}.
	 */
	String declare(String variableName);
}
