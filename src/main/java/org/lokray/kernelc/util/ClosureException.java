package org.lokray.kernelc.util;

/**
 * A function references a non-local name or builtin that cannot be carried into a kernel.
 */
public class ClosureException extends KernelcException
{
	private final String variableName;

	public ClosureException(String message, String variableName)
	{
		super(message);
		this.variableName = variableName;
	}

	public String getVariableName()
	{
		return variableName;
	}
}
