package org.lokray.kernelc;

import java.util.Optional;

/**
 * The translated text of one function or module.
 *
 * @param name      The function name, or the source name for a module.
 * @param text      The kernel source.
 * @param signature The forward declaration, ending in {@code ;}. Null for modules.
 */
public record TranslationResult(String name, String text, String signature)
{
	public Optional<String> getSignature()
	{
		return Optional.ofNullable(signature);
	}
}
