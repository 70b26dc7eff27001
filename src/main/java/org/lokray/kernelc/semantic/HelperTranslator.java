package org.lokray.kernelc.semantic;

import org.lokray.kernelc.KernelFunction;
import org.lokray.kernelc.TranslationResult;
import org.lokray.kernelc.codegen.TranslationContext;

/**
 * Translates a captured helper function within the request that captured it.
 */
@FunctionalInterface
public interface HelperTranslator
{
	TranslationResult translateHelper(KernelFunction helper, TranslationContext context);
}
