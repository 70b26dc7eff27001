package org.lokray.kernelc.semantic;

import org.lokray.kernelc.KernelFunction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The resolved non-local names of one function, in the order they were first referenced.
 * Immutable once built.
 */
public final class ClosureEnvironment
{
	public static final ClosureEnvironment EMPTY = new ClosureEnvironment(Map.of());

	private final Map<String, ClosureBinding> bindings;

	private ClosureEnvironment(Map<String, ClosureBinding> bindings)
	{
		this.bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
	}

	public static Builder builder()
	{
		return new Builder();
	}

	public Optional<String> getGlobalType(String name)
	{
		if (bindings.get(name) instanceof ClosureBinding.ResolvedGlobal global)
		{
			return Optional.of(global.typeName());
		}
		return Optional.empty();
	}

	public boolean isHelper(String name)
	{
		return bindings.get(name) instanceof ClosureBinding.ResolvedFunction;
	}

	List<String> getHelperNames()
	{
		List<String> names = new ArrayList<>();
		bindings.forEach((name, binding) ->
		{
			if (binding instanceof ClosureBinding.ResolvedFunction)
			{
				names.add(name);
			}
		});
		return names;
	}

	public Map<String, ClosureBinding> getBindings()
	{
		return bindings;
	}

	public static class Builder
	{
		private final Map<String, ClosureBinding> bindings = new LinkedHashMap<>();

		public Builder global(String name, String typeName)
		{
			bindings.put(name, new ClosureBinding.ResolvedGlobal(typeName));
			return this;
		}

		public Builder function(String name, KernelFunction function)
		{
			bindings.put(name, new ClosureBinding.ResolvedFunction(function));
			return this;
		}

		public ClosureEnvironment build()
		{
			return new ClosureEnvironment(bindings);
		}
	}
}
