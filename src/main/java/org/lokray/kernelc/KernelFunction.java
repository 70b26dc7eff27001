package org.lokray.kernelc;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A function to translate: its source text and the values its free names are bound to.
 * <p>
 * Bindings can be added after construction so that functions may refer to themselves or
 * to each other. Two instances are the same function only if they are the same object.
 */
public final class KernelFunction
{
	private final String source;
	private final String sourceName;
	private final Map<String, Object> bindings = new LinkedHashMap<>();

	public KernelFunction(String source)
	{
		this(source, "<kernel>");
	}

	/**
	 * @param source     The function source. Leading indentation common to all lines is ignored.
	 * @param sourceName A name for the source used in log output, usually its file name.
	 */
	public KernelFunction(String source, String sourceName)
	{
		this.source = Objects.requireNonNull(source, "source");
		this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
	}

	public static KernelFunction of(String source, Map<String, ?> bindings)
	{
		KernelFunction function = new KernelFunction(source);
		bindings.forEach(function::bind);
		return function;
	}

	/**
	 * Binds a free name. A null value stands for the absence value.
	 */
	public KernelFunction bind(String name, Object value)
	{
		bindings.put(Objects.requireNonNull(name, "name"), value);
		return this;
	}

	public String getSource()
	{
		return source;
	}

	public String getSourceName()
	{
		return sourceName;
	}

	public boolean isBound(String name)
	{
		return bindings.containsKey(name);
	}

	public Object getBinding(String name)
	{
		return bindings.get(name);
	}

	public Map<String, Object> getBindings()
	{
		return Collections.unmodifiableMap(bindings);
	}

	@Override
	public String toString()
	{
		return "KernelFunction[" + sourceName + "]";
	}
}
