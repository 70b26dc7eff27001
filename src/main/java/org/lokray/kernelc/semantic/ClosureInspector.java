package org.lokray.kernelc.semantic;

import org.lokray.kernelc.KernelFunction;
import org.lokray.kernelc.KernelScalar;
import org.lokray.kernelc.TranslationResult;
import org.lokray.kernelc.ast.stmt.FunctionDefStmt;
import org.lokray.kernelc.codegen.TranslationContext;
import org.lokray.kernelc.semantic.type.HostType;
import org.lokray.kernelc.util.ClosureException;
import org.lokray.kernelc.util.Debug;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Classifies the free names of a function before it is translated.
 * <p>
 * Bound names must be scalars, other functions or the DSL namespace marker. Unbound names
 * that are source-language builtins must be {@code range} or {@code len}. Any other unbound
 * name is left for the translator to reject.
 */
public class ClosureInspector
{
	public static final String NAMESPACE_MARKER = "okl";
	public static final Set<String> ALLOWED_BUILTINS = Set.of("range", "len");

	// Builtins of the source language that a function body could reach without binding them
	static final Set<String> BUILTIN_NAMES = Set.of(
			"abs", "all", "any", "ascii", "bin", "bool", "breakpoint", "bytearray", "bytes", "callable",
			"chr", "classmethod", "compile", "complex", "delattr", "dict", "dir", "divmod", "enumerate",
			"eval", "exec", "filter", "float", "format", "frozenset", "getattr", "globals", "hasattr",
			"hash", "help", "hex", "id", "input", "int", "isinstance", "issubclass", "iter", "len", "list",
			"locals", "map", "max", "memoryview", "min", "next", "object", "oct", "open", "ord", "pow",
			"print", "property", "range", "repr", "reversed", "round", "set", "setattr", "slice", "sorted",
			"staticmethod", "str", "sum", "super", "tuple", "type", "vars", "zip");

	private final HelperTranslator helperTranslator;

	public ClosureInspector(HelperTranslator helperTranslator)
	{
		this.helperTranslator = helperTranslator;
	}

	/**
	 * Builds the closure environment of {@code function}, translating every helper it
	 * captures into {@code context} first.
	 *
	 * @param function   The function whose bindings are inspected.
	 * @param definition Its parsed definition.
	 * @param context    The request the function is translated in.
	 * @throws ClosureException if a free name cannot be carried into the kernel.
	 */
	public ClosureEnvironment inspect(KernelFunction function, FunctionDefStmt definition, TranslationContext context)
	{
		List<String> references = NameReferenceCollector.collect(definition);
		Debug.logDebug("Closure of '" + definition.name() + "' references " + references);

		ClosureEnvironment.Builder environment = ClosureEnvironment.builder();
		for (String name : references)
		{
			if (!function.isBound(name))
			{
				continue;
			}

			Object value = function.getBinding(name);
			if (value instanceof KernelFunction helper)
			{
				resolveHelper(name, helper, function, context);
				environment.function(name, helper);
				continue;
			}

			Optional<HostType> scalarType = classifyScalar(value);
			if (scalarType.isPresent())
			{
				environment.global(name, scalarType.get().getKernelType().getKernelName());
			}
			else if (!NAMESPACE_MARKER.equals(name))
			{
				throw new ClosureException("Unable to transform non-local variable: " + name, name);
			}
		}

		for (String name : references)
		{
			if (!function.isBound(name) && BUILTIN_NAMES.contains(name) && !ALLOWED_BUILTINS.contains(name))
			{
				throw new ClosureException("Unable to transform builtin: " + name, name);
			}
		}

		return environment.build();
	}

	private void resolveHelper(String name, KernelFunction helper, KernelFunction owner, TranslationContext context)
	{
		if (helper == owner)
		{
			return;
		}
		// A call back into a function still being translated needs only its declaration
		if (context.isInProgress(helper))
		{
			context.callBack(helper);
			return;
		}
		if (context.register(name, helper))
		{
			Debug.logDebug("Translating helper function '" + name + "'");
			TranslationResult result = helperTranslator.translateHelper(helper, context);
			context.complete(name, result);
		}
	}

	/**
	 * Maps a closure value to its host scalar type. Null is the absence value.
	 */
	public static Optional<HostType> classifyScalar(Object value)
	{
		if (value == null)
		{
			return Optional.of(HostType.NONE);
		}
		if (value instanceof KernelScalar scalar)
		{
			return Optional.of(scalar.type());
		}
		return HostType.forJavaValue(value);
	}
}
