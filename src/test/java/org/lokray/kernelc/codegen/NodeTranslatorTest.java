package org.lokray.kernelc.codegen;

import org.junit.jupiter.api.Test;
import org.lokray.kernelc.ast.SourceModule;
import org.lokray.kernelc.ast.SourcePosition;
import org.lokray.kernelc.ast.expr.CallExpr;
import org.lokray.kernelc.ast.expr.Expr;
import org.lokray.kernelc.ast.expr.NameExpr;
import org.lokray.kernelc.ast.expr.NumberLiteral;
import org.lokray.kernelc.ast.stmt.ForStmt;
import org.lokray.kernelc.ast.stmt.FunctionDefStmt;
import org.lokray.kernelc.ast.stmt.PassStmt;
import org.lokray.kernelc.parser.SourceParser;
import org.lokray.kernelc.semantic.ClosureEnvironment;
import org.lokray.kernelc.util.ErrorReporter;
import org.lokray.kernelc.util.TranslationException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class NodeTranslatorTest
{
	private static final SourcePosition AT = SourcePosition.UNKNOWN;

	private static String translate(String source)
	{
		return translate(source, ClosureEnvironment.EMPTY);
	}

	private static String translate(String source, ClosureEnvironment closure)
	{
		String normalized = SourceParser.normalize(source);
		ErrorReporter errorReporter = new ErrorReporter(normalized);
		SourceModule module = new SourceParser().parse(normalized, "test", errorReporter);
		return new NodeTranslator(closure, errorReporter).translate(module, "");
	}

	private static String body(String... lines)
	{
		StringBuilder source = new StringBuilder("def f(a: int, b: int, c: List[float]) -> None:\n");
		for (String line : lines)
		{
			source.append("    ").append(line).append('\n');
		}
		return source.toString();
	}

	private static String bodyOf(String translated)
	{
		int open = translated.indexOf("{\n");
		return translated.substring(open + 2, translated.lastIndexOf("\n}"));
	}

	private static String fails(String source)
	{
		return assertThrows(TranslationException.class, () -> translate(source)).getDiagnostic().message();
	}

	@Test
	void mapsBinaryOperators()
	{
		assertEquals("  a = a + b;\n  a = a % b;\n  a = a << b;\n  a = a ^ b;\n  a = a & b;\n  a = a | b;",
				bodyOf(translate(body("a = a + b", "a = a % b", "a = a << b", "a = a ^ b", "a = a & b", "a = a | b"))));
	}

	@Test
	void rendersPowerAndFloorDivisionAsCalls()
	{
		assertEquals("  a = pow(a, 2);\n  a = floor(a / b);",
				bodyOf(translate(body("a = a ** 2", "a = a // b"))));
	}

	@Test
	void keepsGroupingOfNestedOperations()
	{
		assertEquals("  a = (a + b) * 2;\n  a = a - (b - 1);\n  a = -(a + b);\n  a = a + b * 2;",
				bodyOf(translate(body("a = (a + b) * 2", "a = a - (b - 1)", "a = -(a + b)", "a = a + b * 2"))));
	}

	@Test
	void rejectsMatrixMultiplication()
	{
		assertEquals("Unable to handle operator", fails(body("a = a @ b")));
	}

	@Test
	void mapsUnaryOperators()
	{
		assertEquals("  a = ~a;\n  a = -a;\n  a = +a;\n  if (!(a < b)) {}",
				bodyOf(translate(body("a = ~a", "a = -a", "a = +a", "if not a < b:", "    pass"))));
	}

	@Test
	void mapsAugmentedAssignments()
	{
		assertEquals("  a += 1;\n  a -= 1;\n  a *= 2;\n  a <<= 1;\n  a >>= 1;\n  a |= b;\n  a &= b;\n  a ^= b;",
				bodyOf(translate(body("a += 1", "a -= 1", "a *= 2", "a <<= 1", "a >>= 1", "a |= b", "a &= b", "a ^= b"))));
	}

	@Test
	void expandsPowerAndFloorDivisionAssignments()
	{
		assertEquals("  a = pow(a, b);\n  a = floor(a / 2);",
				bodyOf(translate(body("a **= b", "a //= 2"))));
	}

	@Test
	void mapsBooleanOperatorsAndIdentity()
	{
		assertEquals("  if (a == NULL || b != NULL) {}",
				bodyOf(translate(body("if a is None or b is not None:", "    pass"))));
		assertEquals("  if ((a || b) && c[0] > 1.5) {}",
				bodyOf(translate(body("if (a or b) and c[0] > 1.5:", "    pass"))));
	}

	@Test
	void rejectsMembershipTests()
	{
		assertEquals("Cannot handle comparison operator", fails(body("if a in c:", "    pass")));
		assertEquals("Cannot handle comparison operator", fails(body("if a not in c:", "    pass")));
	}

	@Test
	void declaresAnnotatedVariablesInTheCurrentScope()
	{
		assertEquals("  int x;\n  x = a;\n  const float y = 1.0;\n  float z = 0.5;",
				bodyOf(translate(body("x: int", "x = a", "y: Const[float] = 1.0", "z: float32 = 0.5"))));
	}

	@Test
	void declaresArrays()
	{
		assertEquals("  @shared float tile[16][4];\n  @exclusive int counter;",
				bodyOf(translate(body("tile: Shared[List[float, 16, 4]]", "counter: Exclusive[int]"))));
	}

	@Test
	void rejectsAssignmentToUndeclaredName()
	{
		assertEquals("Cannot handle untyped variables", fails(body("x = 1")));
	}

	@Test
	void declarationsDoNotOutliveTheirBlock()
	{
		assertEquals("Cannot handle untyped variables", fails(body("if a > b:", "    x: int = 1", "x = 2")));
	}

	@Test
	void rejectsUndefinedNames()
	{
		assertEquals("Undefined name: q", fails(body("a = q")));
	}

	@Test
	void rendersGlobalsAsTheirType()
	{
		ClosureEnvironment closure = ClosureEnvironment.builder().global("scale", "double").build();

		assertEquals("  a = a * double;", bodyOf(translate(body("a = a * scale"), closure)));
	}

	@Test
	void rendersAttributesSubscriptsAndLists()
	{
		assertEquals("  a = okl.get_global_id(0);\n  c[a] = c[b];\n  int d[3] = {1, 2, 3};",
				bodyOf(translate(body("a = okl.get_global_id(0)", "c[a] = c[b]", "d: List[int, 3] = [1, 2, 3]"))));
	}

	@Test
	void rejectsSlicesAndMultiIndexAccess()
	{
		assertEquals("Can only handle single access slices", fails(body("a = c[1:2]")));
		assertEquals("Can only handle single access slices", fails(body("a = c[1, 2]")));
	}

	@Test
	void rendersLiterals()
	{
		assertEquals("  bool x = true;\n  x = false;\n  a = 16;\n  c[0] = 1e-05;\n  c[0] = 100.0;",
				bodyOf(translate(body("x: bool = True", "x = False", "a = 0x10", "c[0] = 0.00001", "c[0] = 1e2"))));
	}

	@Test
	void rejectsStrings()
	{
		assertEquals("Unable to handle node type StringLiteral", fails(body("a = 'text'")));
	}

	@Test
	void rendersElseIfChains()
	{
		String out = translate("""
				def sign(x: int) -> int:
				    if x > 0:
				        return 1
				    elif x < 0:
				        return -1
				    else:
				        return 0
				""");

		assertEquals("int sign(int x) {\n"
				+ "  if (x > 0) {\n"
				+ "    return 1;\n"
				+ "  }\n"
				+ "  else if (x < 0) {\n"
				+ "    return -1;\n"
				+ "  }\n"
				+ "  else {\n"
				+ "    return 0;\n"
				+ "  }\n"
				+ "}", out);
	}

	@Test
	void rendersWhileLoopsAndJumps()
	{
		assertEquals("  while (a < b) {\n    a += 1;\n    if (a == 3) {\n      continue;\n    }\n    break;\n  }\n  return;",
				bodyOf(translate(body("while a < b:", "    a += 1", "    if a == 3:", "        continue", "    break", "return"))));
	}

	@Test
	void rejectsLoopElseClauses()
	{
		assertEquals("Cannot handle statement after while", fails(body("while a < b:", "    a += 1", "else:", "    a = 0")));
		assertEquals("Cannot handle statement after for", fails(body("for i in range(a):", "    pass", "else:", "    a = 0")));
	}

	@Test
	void rejectsLoopsOverOtherIterables()
	{
		assertEquals("Unable to transform this iterable", fails(body("for i in c:", "    pass")));
		assertEquals("Can only handle one variable for the for-loop index", fails(body("for i, j in range(a):", "    pass")));
	}

	@Test
	void loopIndexIsDeclaredInsideTheLoopOnly()
	{
		assertEquals("  for (int i = 0; i < 10; ++i) {\n    c[i] = c[i] * 2;\n  }",
				bodyOf(translate(body("for i in range(a):", "    c[i] = c[i] * 2"))));
		assertEquals("Undefined name: i", fails(body("for i in range(a):", "    pass", "a = i")));
	}

	@Test
	void rendersStepSizes()
	{
		assertEquals("for (int i = 10; i < 0; i -= 2) {}", translateLoop(new LoopBounds("10", "0", -2)));
		assertEquals("for (int i = 10; i < 0; --i) {}", translateLoop(new LoopBounds("10", "0", -1)));
		assertEquals("for (int i = 0; i < 10; i += 3) {}", translateLoop(new LoopBounds("0", "10", 3)));
	}

	@Test
	void zeroStepLoopFails()
	{
		TranslationException error = assertThrows(TranslationException.class,
				() -> translateLoop(new LoopBounds("0", "10", 0)));
		assertEquals("Cannot have for-loop with a step size of 0", error.getDiagnostic().message());
	}

	private static String translateLoop(LoopBounds bounds)
	{
		Expr iterable = new CallExpr(new NameExpr("range", AT), List.of(NumberLiteral.ofInteger(10, AT)), AT);
		ForStmt loop = new ForStmt(new NameExpr("i", AT), iterable, List.of(new PassStmt(AT)), List.of(), AT);

		NodeTranslator translator = new NodeTranslator(ClosureEnvironment.EMPTY, new ErrorReporter(null))
		{
			@Override
			protected LoopBounds resolveLoopBounds(Expr iterable)
			{
				return bounds;
			}
		};
		return translator.translate(loop, "");
	}

	@Test
	void rejectsKeywordAndStarredArguments()
	{
		assertEquals("Cannot handle keyword arguments", fails(body("a = okl.max(a, b=1)")));
		assertEquals("Cannot handle starred arguments", fails(body("a = okl.max(*c)")));
	}

	@Test
	void rejectsUnsupportedSignatures()
	{
		assertEquals("Function must have a return value type", fails("def f(a: int):\n    pass\n"));
		assertEquals("Cannot handle *args", fails("def f(*a: int) -> None:\n    pass\n"));
		assertEquals("Cannot handle **kwargs", fails("def f(**a: int) -> None:\n    pass\n"));
		assertEquals("Cannot handle default arguments yet", fails("def f(a: int = 1) -> None:\n    pass\n"));
		assertEquals("Cannot handle decorator", fails("@okl.device\ndef f() -> None:\n    pass\n"));
	}

	@Test
	void acceptsKeywordOnlyParameters()
	{
		assertEquals("void f(int a,\n       int b) {}", translate("def f(a: int, *, b: int) -> None:\n    pass\n"));
	}

	@Test
	void rewritesKernelDecorator()
	{
		assertEquals("@kernel void run(float *x,\n                 int n) {}",
				translate("@okl.kernel\ndef run(x: List[float32], n: int) -> None:\n    pass\n"));
	}

	@Test
	void alignsNestedFunctionParameters()
	{
		String out = translate("""
				def outer() -> None:
				    def inner(a: int, b: int) -> int:
				        return a
				""");

		assertEquals("void outer() {\n"
				+ "  int inner(int a,\n"
				+ "            int b) {\n"
				+ "    return a;\n"
				+ "  }\n"
				+ "}", out);
	}

	@Test
	void forwardDeclarationEndsWithSemicolon()
	{
		String source = SourceParser.normalize("def add(a: int, b: int) -> int:\n    return a + b\n");
		ErrorReporter errorReporter = new ErrorReporter(source);
		SourceModule module = new SourceParser().parse(source, "test", errorReporter);

		String signature = new NodeTranslator(ClosureEnvironment.EMPTY, errorReporter)
				.translateSignature((FunctionDefStmt) module.body().get(0), true);

		assertEquals("int add(int a,\n        int b);", signature);
	}
}
