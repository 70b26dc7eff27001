package org.lokray.kernelc.codegen;

import org.lokray.kernelc.KernelFunction;
import org.lokray.kernelc.TranslationResult;
import org.lokray.kernelc.util.ClosureException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * State shared by everything translated for one top-level request: the helper functions
 * discovered so far and the functions whose translation is still running.
 * <p>
 * Each helper is translated once per request, however many functions capture it.
 */
public class TranslationContext
{
	private final Map<String, KernelFunction> discovered = new LinkedHashMap<>();
	private final Map<String, TranslationResult> translated = new LinkedHashMap<>();
	private final Set<KernelFunction> inProgress = Collections.newSetFromMap(new IdentityHashMap<>());
	private final Set<KernelFunction> calledBack = Collections.newSetFromMap(new IdentityHashMap<>());

	public void enter(KernelFunction function)
	{
		inProgress.add(function);
	}

	public void exit(KernelFunction function)
	{
		inProgress.remove(function);
	}

	public boolean isInProgress(KernelFunction function)
	{
		return inProgress.contains(function);
	}

	/**
	 * Records a call from a helper back into a function whose translation is still running.
	 * That function is declared before the helpers.
	 */
	public void callBack(KernelFunction function)
	{
		calledBack.add(function);
	}

	public boolean isCalledBack(KernelFunction function)
	{
		return calledBack.contains(function);
	}

	/**
	 * Records a helper under the name it was captured as.
	 *
	 * @return true if the helper is new and must be translated, false if it is already known.
	 * @throws ClosureException if another function was already captured under the same name.
	 */
	public boolean register(String name, KernelFunction function)
	{
		KernelFunction existing = discovered.get(name);
		if (existing == null)
		{
			discovered.put(name, function);
			return true;
		}
		if (existing != function)
		{
			throw new ClosureException("Conflicting helper functions named: " + name, name);
		}
		return false;
	}

	public void complete(String name, TranslationResult result)
	{
		translated.put(name, result);
	}

	/**
	 * @return The finished helper translations in the order the helpers were discovered.
	 */
	public List<TranslationResult> getHelpers()
	{
		List<TranslationResult> helpers = new ArrayList<>();
		for (String name : discovered.keySet())
		{
			TranslationResult result = translated.get(name);
			if (result != null)
			{
				helpers.add(result);
			}
		}
		return helpers;
	}
}
