package org.lokray.kernelc.semantic;

import org.lokray.kernelc.KernelFunction;

/**
 * What a captured non-local name resolved to.
 */
public interface ClosureBinding
{
	/**
	 * A scalar global, carried into the kernel as its primitive type name.
	 */
	record ResolvedGlobal(String typeName) implements ClosureBinding
	{
	}

	/**
	 * A helper function. Its translation is owned by the request's translation context.
	 */
	record ResolvedFunction(KernelFunction function) implements ClosureBinding
	{
	}
}
