package org.lokray.kernelc;

import org.lokray.kernelc.util.KernelcException;

/**
 * Result of one input of a batch translation: either its text or the error that stopped it.
 */
public record BatchOutcome(int index, String text, KernelcException error)
{
	public static BatchOutcome success(int index, String text)
	{
		return new BatchOutcome(index, text, null);
	}

	public static BatchOutcome failure(int index, KernelcException error)
	{
		return new BatchOutcome(index, null, error);
	}

	public boolean isSuccess()
	{
		return error == null;
	}
}
