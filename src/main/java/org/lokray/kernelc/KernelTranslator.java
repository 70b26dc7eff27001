package org.lokray.kernelc;

import org.lokray.kernelc.ast.SourceModule;
import org.lokray.kernelc.ast.SyntaxNode;
import org.lokray.kernelc.ast.stmt.FunctionDefStmt;
import org.lokray.kernelc.codegen.KernelEmitter;
import org.lokray.kernelc.codegen.NodeTranslator;
import org.lokray.kernelc.codegen.TranslationContext;
import org.lokray.kernelc.parser.SourceParser;
import org.lokray.kernelc.semantic.ClosureEnvironment;
import org.lokray.kernelc.semantic.ClosureInspector;
import org.lokray.kernelc.semantic.HelperTranslator;
import org.lokray.kernelc.util.ClosureException;
import org.lokray.kernelc.util.Debug;
import org.lokray.kernelc.util.ErrorReporter;
import org.lokray.kernelc.util.KernelcException;
import org.lokray.kernelc.util.TranslationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point of the translator. Each call is an independent request: helper functions
 * are translated once per call and nothing is kept between calls.
 */
public class KernelTranslator implements HelperTranslator
{
	private final SourceParser parser = new SourceParser();
	private final ClosureInspector closureInspector = new ClosureInspector(this);

	/**
	 * Translates a function together with every helper function it captures.
	 *
	 * @throws ClosureException     if a free name cannot be carried into the kernel.
	 * @throws TranslationException if the function uses a construct the kernel language lacks.
	 */
	public String translate(KernelFunction function)
	{
		ErrorReporter.clearLastErrorNode();
		TranslationContext context = new TranslationContext();
		TranslationResult root = translateFunction(function, context);
		return new KernelEmitter(context, function, root).emit();
	}

	/**
	 * Translates a tree built by hand. It has no closure, so it can only use names it declares.
	 */
	public String translate(SyntaxNode node)
	{
		ErrorReporter.clearLastErrorNode();
		NodeTranslator translator = new NodeTranslator(ClosureEnvironment.EMPTY, new ErrorReporter(null));
		return new KernelEmitter(List.of(), translator.translate(node, "")).emit();
	}

	/**
	 * Translates every statement of a source file. Used by the command line, where there
	 * are no closure bindings.
	 */
	public TranslationResult translateSource(String source, String sourceName)
	{
		ErrorReporter.clearLastErrorNode();
		String normalized = SourceParser.normalize(source);
		ErrorReporter errorReporter = new ErrorReporter(normalized);
		SourceModule module = parser.parse(normalized, sourceName, errorReporter);

		NodeTranslator translator = new NodeTranslator(ClosureEnvironment.EMPTY, errorReporter);
		return new TranslationResult(sourceName, translator.translate(module, ""), null);
	}

	/**
	 * Translates each input independently. Inputs are {@link KernelFunction}s or
	 * {@link SyntaxNode}s; outcomes are in input order.
	 *
	 * @throws IllegalArgumentException if an input is neither.
	 */
	public List<BatchOutcome> translateAll(List<?> inputs)
	{
		List<BatchOutcome> outcomes = new ArrayList<>();
		for (int i = 0; i < inputs.size(); i++)
		{
			Object input = inputs.get(i);
			try
			{
				if (input instanceof KernelFunction function)
				{
					outcomes.add(BatchOutcome.success(i, translate(function)));
				}
				else if (input instanceof SyntaxNode node)
				{
					outcomes.add(BatchOutcome.success(i, translate(node)));
				}
				else
				{
					throw new IllegalArgumentException("Unable to translate object of type "
							+ (input == null ? "null" : input.getClass().getName()));
				}
			}
			catch (KernelcException e)
			{
				Debug.logDebug("Batch input " + i + " failed: " + e.getMessage());
				outcomes.add(BatchOutcome.failure(i, e));
			}
		}
		return outcomes;
	}

	@Override
	public TranslationResult translateHelper(KernelFunction helper, TranslationContext context)
	{
		return translateFunction(helper, context);
	}

	private TranslationResult translateFunction(KernelFunction function, TranslationContext context)
	{
		String source = SourceParser.normalize(function.getSource());
		ErrorReporter errorReporter = new ErrorReporter(source);
		SourceModule module = parser.parse(source, function.getSourceName(), errorReporter);
		FunctionDefStmt definition = findDefinition(module, errorReporter);

		context.enter(function);
		try
		{
			ClosureEnvironment closure = closureInspector.inspect(function, definition, context);
			NodeTranslator translator = new NodeTranslator(closure, errorReporter);
			String text = translator.translate(module, "");
			String signature = translator.translateSignature(definition, true);
			Debug.logDebug("Translated function '" + definition.name() + "'");
			return new TranslationResult(definition.name(), text, signature);
		}
		finally
		{
			context.exit(function);
		}
	}

	private static FunctionDefStmt findDefinition(SourceModule module, ErrorReporter errorReporter)
	{
		if (module.body().isEmpty() || !(module.body().get(0) instanceof FunctionDefStmt definition))
		{
			SyntaxNode at = module.body().isEmpty() ? module : module.body().get(0);
			throw errorReporter.error(at, "Expected a function definition");
		}
		if (module.body().size() > 1)
		{
			throw errorReporter.error(module.body().get(1), "Expected a single function definition");
		}
		return definition;
	}
}
