package org.lokray.kernelc.semantic.type;

import org.lokray.kernelc.ast.expr.*;
import org.lokray.kernelc.semantic.ClosureEnvironment;
import org.lokray.kernelc.util.ErrorReporter;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Maps annotation expressions to kernel declarations.
 * <p>
 * Recognised forms: a bare type name, {@code None}, {@code List[T]} (pointer),
 * {@code List[T, d1, ...]} (fixed-size array) and the qualifier wrappers
 * {@code Const[T]}, {@code Exclusive[T]} and {@code Shared[T]}.
 */
public class TypeAnnotationResolver
{
	public static final String LIST_GENERIC = "List";

	private final ClosureEnvironment closure;
	private final ErrorReporter errorReporter;
	private final Function<Expr, String> expressionRenderer;

	/**
	 * @param closure            Globals of the function being translated; a global used as a type name
	 *                           stands for its own type.
	 * @param errorReporter      Reporter bound to the source being translated.
	 * @param expressionRenderer Renders array dimension expressions.
	 */
	public TypeAnnotationResolver(ClosureEnvironment closure, ErrorReporter errorReporter, Function<Expr, String> expressionRenderer)
	{
		this.closure = closure;
		this.errorReporter = errorReporter;
		this.expressionRenderer = expressionRenderer;
	}

	/**
	 * Resolves an annotation into a declaration of {@code variableName}. An absent annotation
	 * yields the bare variable name, which callers treat as "untyped".
	 */
	public String resolve(Expr annotation, String variableName)
	{
		if (annotation == null)
		{
			return variableName;
		}
		return resolveType(annotation).declare(variableName);
	}

	public TypeAnnotation resolveType(Expr annotation)
	{
		if (annotation instanceof NameExpr name)
		{
			return new BasicType(resolveTypeName(name.id()));
		}

		if (annotation instanceof NoneLiteral)
		{
			return BasicType.VOID;
		}

		if (annotation instanceof SubscriptExpr subscript)
		{
			if (subscript.index() instanceof SliceExpr)
			{
				throw errorReporter.error(subscript.index(), "Can only handle single access slices");
			}

			String generic = subscript.value() instanceof NameExpr head ? head.id() : null;
			if (LIST_GENERIC.equals(generic))
			{
				return resolveListType(subscript.index());
			}

			Optional<Qualifier> qualifier = Qualifier.forGenericName(generic);
			if (qualifier.isPresent())
			{
				return new QualifiedType(qualifier.get(), resolveType(subscript.index()));
			}
		}

		throw errorReporter.error(annotation, "Cannot handle type annotation");
	}

	private TypeAnnotation resolveListType(Expr index)
	{
		if (!(index instanceof TupleExpr tuple))
		{
			return new PointerType(resolveType(index));
		}

		List<Expr> elements = tuple.elements();
		if (elements.isEmpty())
		{
			throw errorReporter.error(index, "Cannot handle type annotation");
		}

		TypeAnnotation elementType = resolveType(elements.get(0));
		List<String> dimensions = new ArrayList<>();
		for (Expr dimension : elements.subList(1, elements.size()))
		{
			dimensions.add(expressionRenderer.apply(dimension));
		}
		return new ArrayType(elementType, dimensions);
	}

	private String resolveTypeName(String name)
	{
		Optional<String> global = closure.getGlobalType(name);
		if (global.isPresent())
		{
			return global.get();
		}
		return HostType.forAnnotationName(name)
				.map(host -> host.getKernelType().getKernelName())
				.orElse(name);
	}
}
