package org.lokray.kernelc.semantic;

import org.junit.jupiter.api.Test;
import org.lokray.kernelc.ast.SourceModule;
import org.lokray.kernelc.ast.stmt.FunctionDefStmt;
import org.lokray.kernelc.parser.SourceParser;
import org.lokray.kernelc.util.ErrorReporter;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class NameReferenceCollectorTest
{
	private static List<String> collect(String source)
	{
		String normalized = SourceParser.normalize(source);
		SourceModule module = new SourceParser().parse(normalized, "test", new ErrorReporter(normalized));
		return NameReferenceCollector.collect((FunctionDefStmt) module.body().get(0));
	}

	@Test
	void collectsFreeNamesInOrderOfFirstUse()
	{
		assertEquals(List.of("scale", "g", "okl"), collect("""
				def f(x: float) -> float:
				    y: float = x * scale
				    y = g(y) + scale
				    return y + okl.get_global_id(0)
				"""));
	}

	@Test
	void localsAreLocalEverywhereInTheFunction()
	{
		// Read before its declaration, still local
		assertEquals(List.of(), collect("""
				def f() -> int:
				    if True:
				        return t
				    t: int = 1
				    return t
				"""));
	}

	@Test
	void loopIndexAndNestedDefinitionsAreBound()
	{
		assertEquals(List.of("range", "n"), collect("""
				def f(a: List[int]) -> None:
				    def inner(v: int) -> int:
				        return v * hidden
				    for i in range(n):
				        a[i] = inner(i)
				"""));
	}

	@Test
	void annotationsAreNotReferences()
	{
		assertEquals(List.of(), collect("""
				def f(a: List[Real]) -> Width:
				    b: Shared[List[float, 16]]
				    return a
				"""));
	}

	@Test
	void arrayDimensionsInAnnotationsAreReferences()
	{
		assertEquals(List.of("size", "BLOCK"), collect("""
				def f(a: List[float, size], n: int) -> None:
				    b: Shared[List[Real, BLOCK, n]]
				"""));
	}

	@Test
	void subscriptTargetsReadTheirBase()
	{
		assertEquals(List.of("buffer", "i"), collect("def f() -> None:\n    buffer[i] = 1\n"));
	}
}
