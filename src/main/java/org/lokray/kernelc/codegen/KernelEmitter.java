package org.lokray.kernelc.codegen;

import org.lokray.kernelc.KernelFunction;
import org.lokray.kernelc.TranslationResult;
import org.lokray.kernelc.util.Debug;

import java.util.ArrayList;
import java.util.List;

/**
 * Assembles the final kernel source: helper forward declarations, helper bodies, then the
 * root body, separated by blank lines. Helpers keep the order in which they were discovered.
 * A root that a helper calls back is declared ahead of the helper declarations.
 */
public class KernelEmitter
{
	private static final String SEPARATOR = "\n\n";

	private final List<TranslationResult> helpers;
	private final String rootText;
	private final String rootDeclaration;

	public KernelEmitter(TranslationContext context, KernelFunction rootFunction, TranslationResult root)
	{
		this(context.getHelpers(), root.text(),
				context.isCalledBack(rootFunction) ? root.getSignature().orElse(null) : null);
	}

	public KernelEmitter(List<TranslationResult> helpers, String rootText)
	{
		this(helpers, rootText, null);
	}

	private KernelEmitter(List<TranslationResult> helpers, String rootText, String rootDeclaration)
	{
		this.helpers = List.copyOf(helpers);
		this.rootText = rootText;
		this.rootDeclaration = rootDeclaration;
	}

	public String emit()
	{
		List<String> sections = new ArrayList<>();
		if (rootDeclaration != null)
		{
			sections.add(rootDeclaration);
		}
		for (TranslationResult helper : helpers)
		{
			helper.getSignature().ifPresent(sections::add);
		}
		for (TranslationResult helper : helpers)
		{
			sections.add(helper.text());
		}
		sections.add(rootText);

		Debug.logDebug("Emitting kernel with " + helpers.size() + " helper function(s)");
		return String.join(SEPARATOR, sections);
	}
}
