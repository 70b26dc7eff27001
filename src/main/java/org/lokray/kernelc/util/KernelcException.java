package org.lokray.kernelc.util;

/**
 * Base of every failure raised while translating a kernel.
 */
public abstract class KernelcException extends RuntimeException
{
	protected KernelcException(String message)
	{
		super(message);
	}
}
