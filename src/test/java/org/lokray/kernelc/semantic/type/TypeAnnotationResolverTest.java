package org.lokray.kernelc.semantic.type;

import org.junit.jupiter.api.Test;
import org.lokray.kernelc.ast.SourcePosition;
import org.lokray.kernelc.ast.expr.Expr;
import org.lokray.kernelc.ast.expr.ListExpr;
import org.lokray.kernelc.ast.expr.NameExpr;
import org.lokray.kernelc.ast.expr.NoneLiteral;
import org.lokray.kernelc.ast.expr.NumberLiteral;
import org.lokray.kernelc.ast.expr.SubscriptExpr;
import org.lokray.kernelc.ast.expr.TupleExpr;
import org.lokray.kernelc.semantic.ClosureEnvironment;
import org.lokray.kernelc.util.ErrorReporter;
import org.lokray.kernelc.util.TranslationException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class TypeAnnotationResolverTest
{
	private static final SourcePosition AT = SourcePosition.UNKNOWN;

	private final TypeAnnotationResolver resolver = resolver(ClosureEnvironment.EMPTY);

	private static TypeAnnotationResolver resolver(ClosureEnvironment closure)
	{
		return new TypeAnnotationResolver(closure, new ErrorReporter(null), expression ->
				expression instanceof NumberLiteral number ? number.text() : ((NameExpr) expression).id());
	}

	private static Expr name(String id)
	{
		return new NameExpr(id, AT);
	}

	private static Expr generic(String head, Expr... arguments)
	{
		Expr index = arguments.length == 1 ? arguments[0] : new TupleExpr(List.of(arguments), AT);
		return new SubscriptExpr(name(head), index, AT);
	}

	private static Expr number(long value)
	{
		return NumberLiteral.ofInteger(value, AT);
	}

	@Test
	void mapsHostScalarNames()
	{
		assertEquals("int x", resolver.resolve(name("int"), "x"));
		assertEquals("float x", resolver.resolve(name("float"), "x"));
		assertEquals("float x", resolver.resolve(name("float32"), "x"));
		assertEquals("double x", resolver.resolve(name("float64"), "x"));
		assertEquals("char x", resolver.resolve(name("uint8"), "x"));
		assertEquals("short x", resolver.resolve(name("int16"), "x"));
		assertEquals("long x", resolver.resolve(name("uint64"), "x"));
		assertEquals("bool x", resolver.resolve(name("bool"), "x"));
	}

	@Test
	void passesUnknownNamesThrough()
	{
		assertEquals("float4 v", resolver.resolve(name("float4"), "v"));
	}

	@Test
	void noneIsVoid()
	{
		assertEquals("void", resolver.resolve(new NoneLiteral(AT), ""));
		assertEquals("void", resolver.resolve(name("None"), ""));
	}

	@Test
	void missingAnnotationLeavesTheBareName()
	{
		assertEquals("x", resolver.resolve(null, "x"));
	}

	@Test
	void listsArePointers()
	{
		assertEquals("int *p", resolver.resolve(generic("List", name("int")), "p"));
		assertEquals("float **p", resolver.resolve(generic("List", generic("List", name("float"))), "p"));
	}

	@Test
	void listsWithDimensionsAreArrays()
	{
		assertEquals("float m[4][8]", resolver.resolve(generic("List", name("float32"), number(4), number(8)), "m"));
		assertEquals("int v[n]", resolver.resolve(generic("List", name("int"), name("n")), "v"));
	}

	@Test
	void qualifiersPrefixTheDeclaration()
	{
		assertEquals("const int *p", resolver.resolve(generic("Const", generic("List", name("int"))), "p"));
		assertEquals("@shared float tile[16]", resolver.resolve(generic("Shared", generic("List", name("float"), number(16))), "tile"));
		assertEquals("@exclusive int id", resolver.resolve(generic("Exclusive", name("int")), "id"));
	}

	@Test
	void globalTypeNamesResolveToTheirType()
	{
		TypeAnnotationResolver withGlobals = resolver(ClosureEnvironment.builder().global("real", "float").build());

		assertEquals("float r", withGlobals.resolve(name("real"), "r"));
	}

	@Test
	void rejectsOtherAnnotations()
	{
		TranslationException error = assertThrows(TranslationException.class,
				() -> resolver.resolve(generic("Dict", name("int")), "d"));
		assertEquals("Cannot handle type annotation", error.getDiagnostic().message());

		assertThrows(TranslationException.class, () -> resolver.resolve(new ListExpr(List.of(), AT), "l"));
	}
}
