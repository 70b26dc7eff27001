package org.lokray.kernelc.codegen;

import org.lokray.kernelc.ast.SourceModule;
import org.lokray.kernelc.ast.SyntaxNode;
import org.lokray.kernelc.ast.SyntaxVisitor;
import org.lokray.kernelc.ast.expr.*;
import org.lokray.kernelc.ast.stmt.*;
import org.lokray.kernelc.semantic.ClosureEnvironment;
import org.lokray.kernelc.semantic.ClosureInspector;
import org.lokray.kernelc.semantic.ScopeStack;
import org.lokray.kernelc.semantic.type.TypeAnnotationResolver;
import org.lokray.kernelc.util.ErrorReporter;
import org.lokray.kernelc.util.TranslationException;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a syntax tree as kernel source, one rule per node kind.
 * <p>
 * The first construct without a kernel equivalent aborts the whole translation with a
 * {@link TranslationException}. An instance keeps scope and indentation state while it
 * runs and is meant for a single translation.
 */
public class NodeTranslator implements SyntaxVisitor<String>
{
	public static final String INDENT_UNIT = "  ";

	private static final Map<String, String> DECORATORS = Map.of("@okl.kernel", "@kernel");

	private static final Map<BinaryOperator, String> BINARY_FORMATS = new EnumMap<>(BinaryOperator.class);
	private static final Map<BinaryOperator, String> AUGMENTED_FORMATS = new EnumMap<>(BinaryOperator.class);
	private static final Map<UnaryOperator, String> UNARY_SYMBOLS = new EnumMap<>(UnaryOperator.class);
	private static final Map<ComparisonOperator, String> COMPARISON_SYMBOLS = new EnumMap<>(ComparisonOperator.class);

	// Binding strength of the emitted C-like operators, higher binds tighter
	private static final int PRECEDENCE_ATOM = 100;
	private static final int PRECEDENCE_UNARY = 90;
	private static final int PRECEDENCE_AND = 20;
	private static final int PRECEDENCE_OR = 10;
	private static final Map<BinaryOperator, Integer> BINARY_PRECEDENCE = new EnumMap<>(BinaryOperator.class);
	private static final Map<ComparisonOperator, Integer> COMPARISON_PRECEDENCE = new EnumMap<>(ComparisonOperator.class);

	static
	{
		BINARY_FORMATS.put(BinaryOperator.ADD, "%1$s + %2$s");
		BINARY_FORMATS.put(BinaryOperator.SUB, "%1$s - %2$s");
		BINARY_FORMATS.put(BinaryOperator.MULT, "%1$s * %2$s");
		BINARY_FORMATS.put(BinaryOperator.DIV, "%1$s / %2$s");
		BINARY_FORMATS.put(BinaryOperator.MOD, "%1$s %% %2$s");
		BINARY_FORMATS.put(BinaryOperator.POW, "pow(%1$s, %2$s)");
		BINARY_FORMATS.put(BinaryOperator.LSHIFT, "%1$s << %2$s");
		BINARY_FORMATS.put(BinaryOperator.RSHIFT, "%1$s >> %2$s");
		BINARY_FORMATS.put(BinaryOperator.BIT_OR, "%1$s | %2$s");
		BINARY_FORMATS.put(BinaryOperator.BIT_XOR, "%1$s ^ %2$s");
		BINARY_FORMATS.put(BinaryOperator.BIT_AND, "%1$s & %2$s");
		BINARY_FORMATS.put(BinaryOperator.FLOOR_DIV, "floor(%1$s / %2$s)");

		AUGMENTED_FORMATS.put(BinaryOperator.ADD, "%1$s += %2$s;");
		AUGMENTED_FORMATS.put(BinaryOperator.SUB, "%1$s -= %2$s;");
		AUGMENTED_FORMATS.put(BinaryOperator.MULT, "%1$s *= %2$s;");
		AUGMENTED_FORMATS.put(BinaryOperator.DIV, "%1$s /= %2$s;");
		AUGMENTED_FORMATS.put(BinaryOperator.MOD, "%1$s %%= %2$s;");
		AUGMENTED_FORMATS.put(BinaryOperator.POW, "%1$s = pow(%1$s, %2$s);");
		AUGMENTED_FORMATS.put(BinaryOperator.LSHIFT, "%1$s <<= %2$s;");
		AUGMENTED_FORMATS.put(BinaryOperator.RSHIFT, "%1$s >>= %2$s;");
		AUGMENTED_FORMATS.put(BinaryOperator.BIT_OR, "%1$s |= %2$s;");
		AUGMENTED_FORMATS.put(BinaryOperator.BIT_XOR, "%1$s ^= %2$s;");
		AUGMENTED_FORMATS.put(BinaryOperator.BIT_AND, "%1$s &= %2$s;");
		AUGMENTED_FORMATS.put(BinaryOperator.FLOOR_DIV, "%1$s = floor(%1$s / %2$s);");

		UNARY_SYMBOLS.put(UnaryOperator.INVERT, "~");
		UNARY_SYMBOLS.put(UnaryOperator.NOT, "!");
		UNARY_SYMBOLS.put(UnaryOperator.PLUS, "+");
		UNARY_SYMBOLS.put(UnaryOperator.MINUS, "-");

		COMPARISON_SYMBOLS.put(ComparisonOperator.EQ, "==");
		COMPARISON_SYMBOLS.put(ComparisonOperator.NOT_EQ, "!=");
		COMPARISON_SYMBOLS.put(ComparisonOperator.LT, "<");
		COMPARISON_SYMBOLS.put(ComparisonOperator.LT_E, "<=");
		COMPARISON_SYMBOLS.put(ComparisonOperator.GT, ">");
		COMPARISON_SYMBOLS.put(ComparisonOperator.GT_E, ">=");
		COMPARISON_SYMBOLS.put(ComparisonOperator.IS, "==");
		COMPARISON_SYMBOLS.put(ComparisonOperator.IS_NOT, "!=");

		BINARY_PRECEDENCE.put(BinaryOperator.MULT, 80);
		BINARY_PRECEDENCE.put(BinaryOperator.DIV, 80);
		BINARY_PRECEDENCE.put(BinaryOperator.MOD, 80);
		BINARY_PRECEDENCE.put(BinaryOperator.ADD, 70);
		BINARY_PRECEDENCE.put(BinaryOperator.SUB, 70);
		BINARY_PRECEDENCE.put(BinaryOperator.LSHIFT, 60);
		BINARY_PRECEDENCE.put(BinaryOperator.RSHIFT, 60);
		BINARY_PRECEDENCE.put(BinaryOperator.BIT_AND, 40);
		BINARY_PRECEDENCE.put(BinaryOperator.BIT_XOR, 35);
		BINARY_PRECEDENCE.put(BinaryOperator.BIT_OR, 30);

		COMPARISON_PRECEDENCE.put(ComparisonOperator.LT, 50);
		COMPARISON_PRECEDENCE.put(ComparisonOperator.LT_E, 50);
		COMPARISON_PRECEDENCE.put(ComparisonOperator.GT, 50);
		COMPARISON_PRECEDENCE.put(ComparisonOperator.GT_E, 50);
		COMPARISON_PRECEDENCE.put(ComparisonOperator.EQ, 45);
		COMPARISON_PRECEDENCE.put(ComparisonOperator.NOT_EQ, 45);
		COMPARISON_PRECEDENCE.put(ComparisonOperator.IS, 45);
		COMPARISON_PRECEDENCE.put(ComparisonOperator.IS_NOT, 45);
	}

	private final ClosureEnvironment closure;
	private final ErrorReporter errorReporter;
	private final TypeAnnotationResolver typeResolver;
	private final ScopeStack scopes = new ScopeStack();
	private String indent = "";
	// Set while an array dimension renders; globals there keep their own name
	private boolean inDimension;

	public NodeTranslator(ClosureEnvironment closure, ErrorReporter errorReporter)
	{
		this.closure = closure;
		this.errorReporter = errorReporter;
		this.typeResolver = new TypeAnnotationResolver(closure, errorReporter, this::translateDimension);
	}

	/**
	 * Translates a node whose first line starts at {@code indent}.
	 */
	public String translate(SyntaxNode node, String indent)
	{
		String saved = this.indent;
		this.indent = indent;
		scopes.push();
		try
		{
			return node.accept(this);
		}
		finally
		{
			scopes.pop();
			this.indent = saved;
		}
	}

	/**
	 * Renders the head of a function definition: decorators, return type, name and parameters.
	 *
	 * @param terminated Append {@code ;} to form a forward declaration.
	 */
	public String translateSignature(FunctionDefStmt node, boolean terminated)
	{
		if (node.returnType() == null)
		{
			throw errorReporter.error(node, "Function must have a return value type");
		}
		String returns = typeResolver.resolve(node.returnType(), "");

		StringBuilder header = new StringBuilder();
		for (Expr decorator : node.decorators())
		{
			String kernelDecorator = DECORATORS.get("@" + dottedName(decorator));
			if (kernelDecorator == null)
			{
				throw errorReporter.error(decorator, "Cannot handle decorator");
			}
			header.append(kernelDecorator).append(' ');
		}
		header.append(returns).append(' ').append(node.name()).append('(');

		for (Parameter parameter : node.parameters())
		{
			checkParameterKind(parameter);
		}

		// Continuation lines line up under the opening parenthesis
		String separator = ",\n" + indent + " ".repeat(header.length());
		List<String> parameters = new ArrayList<>();
		for (Parameter parameter : node.parameters())
		{
			parameters.add(parameter.accept(this));
		}

		return header + String.join(separator, parameters) + ")" + (terminated ? ";" : "");
	}

	public String translateExpression(Expr expression)
	{
		return expression.accept(this);
	}

	private String translateDimension(Expr dimension)
	{
		boolean saved = inDimension;
		inDimension = true;
		try
		{
			return translateExpression(dimension);
		}
		finally
		{
			inDimension = saved;
		}
	}

	/**
	 * Start, end and step of a counted loop over {@code iterable}, already known to be a
	 * range. Bound expressions are not evaluated yet: every range yields the placeholder.
	 */
	protected LoopBounds resolveLoopBounds(Expr iterable)
	{
		return LoopBounds.PLACEHOLDER;
	}

	// --- Blocks ---

	private String translateBlock(List<Stmt> statements, String blockIndent, List<String> declarations)
	{
		String saved = indent;
		indent = blockIndent;
		scopes.push();
		declarations.forEach(scopes::declare);

		List<String> lines = new ArrayList<>();
		for (Stmt statement : statements)
		{
			String text = statement.accept(this);
			if (!text.isEmpty())
			{
				lines.add(blockIndent + text);
			}
		}

		scopes.pop();
		indent = saved;
		return String.join("\n", lines);
	}

	private String translateBody(List<Stmt> statements, List<String> declarations)
	{
		String block = translateBlock(statements, indent + INDENT_UNIT, declarations);
		if (block.isEmpty())
		{
			return "{}";
		}
		return "{\n" + block + "\n" + indent + "}";
	}

	// --- Statements ---

	@Override
	public String visitModule(SourceModule node)
	{
		return translateBlock(node.body(), indent, List.of());
	}

	@Override
	public String visitFunctionDef(FunctionDefStmt node)
	{
		String signature = translateSignature(node, false);
		// Declared before the body so the function can call itself
		scopes.declare(node.name());

		List<String> parameterNames = node.parameters().stream()
				.map(Parameter::name)
				.toList();
		return signature + " " + translateBody(node.body(), parameterNames);
	}

	@Override
	public String visitParameter(Parameter node)
	{
		checkParameterKind(node);
		String declaration = typeResolver.resolve(node.annotation(), node.name());
		if (declaration.equals(node.name()))
		{
			throw errorReporter.error(node, "Arguments must have a type annotation");
		}
		return declaration;
	}

	private void checkParameterKind(Parameter parameter)
	{
		switch (parameter.kind())
		{
			case KEYWORD_VARIADIC -> throw errorReporter.error(parameter, "Cannot handle **kwargs");
			case VARIADIC -> throw errorReporter.error(parameter, "Cannot handle *args");
			default ->
			{
				if (parameter.hasDefaultValue())
				{
					throw errorReporter.error(parameter, "Cannot handle default arguments yet");
				}
			}
		}
	}

	@Override
	public String visitAssign(AssignStmt node)
	{
		if (node.targets().size() != 1)
		{
			throw errorReporter.error(node, "Cannot handle assignment of more than 1 value");
		}

		Expr target = node.targets().get(0);
		String targetText;
		if (target instanceof NameExpr name)
		{
			if (!scopes.isDefined(name.id()))
			{
				throw errorReporter.error(node, "Cannot handle untyped variables");
			}
			targetText = name.id();
		}
		else
		{
			targetText = translateExpression(target);
		}

		return targetText + " = " + translateExpression(node.value()) + ";";
	}

	@Override
	public String visitAnnAssign(AnnAssignStmt node)
	{
		if (!(node.target() instanceof NameExpr target))
		{
			throw errorReporter.error(node.target(), "Can only declare a single variable name");
		}
		scopes.declare(target.id());

		String declaration = typeResolver.resolve(node.annotation(), target.id());
		if (node.value() != null)
		{
			declaration += " = " + translateExpression(node.value());
		}
		return declaration + ";";
	}

	@Override
	public String visitAugAssign(AugAssignStmt node)
	{
		String format = AUGMENTED_FORMATS.get(node.operator());
		if (format == null)
		{
			throw errorReporter.error(node, "Unable to handle operator");
		}
		return String.format(format, translateExpression(node.target()), translateExpression(node.value()));
	}

	@Override
	public String visitExprStmt(ExprStmt node)
	{
		return translateExpression(node.value()) + ";";
	}

	@Override
	public String visitIf(IfStmt node)
	{
		StringBuilder text = new StringBuilder("if (")
				.append(translateExpression(node.test()))
				.append(") ")
				.append(translateBody(node.body(), List.of()));

		List<Stmt> orElse = node.orElse();
		if (!orElse.isEmpty())
		{
			text.append('\n').append(indent).append("else ");
			if (orElse.size() == 1 && orElse.get(0) instanceof IfStmt elseIf)
			{
				text.append(visitIf(elseIf));
			}
			else
			{
				text.append(translateBody(orElse, List.of()));
			}
		}
		return text.toString();
	}

	@Override
	public String visitFor(ForStmt node)
	{
		if (!(node.target() instanceof NameExpr target))
		{
			throw errorReporter.error(node.target(), "Can only handle one variable for the for-loop index");
		}
		if (!node.orElse().isEmpty())
		{
			throw errorReporter.error(node.orElse().get(0), "Cannot handle statement after for");
		}

		String index = target.id();
		String iterable = translateExpression(node.iterable());
		if (!iterable.startsWith("range") && !iterable.startsWith(ClosureInspector.NAMESPACE_MARKER + ".range"))
		{
			throw errorReporter.error(node.iterable(), "Unable to transform this iterable");
		}

		LoopBounds bounds = resolveLoopBounds(node.iterable());
		String step = formatStep(index, bounds.step(), node.iterable());

		return "for (int " + index + " = " + bounds.start() + "; "
				+ index + " < " + bounds.end() + "; "
				+ step + ") "
				+ translateBody(node.body(), List.of(index));
	}

	private String formatStep(String index, long step, Expr iterable)
	{
		if (step == 0)
		{
			throw errorReporter.error(iterable, "Cannot have for-loop with a step size of 0");
		}
		if (step == 1)
		{
			return "++" + index;
		}
		if (step == -1)
		{
			return "--" + index;
		}
		if (step > 0)
		{
			return index + " += " + step;
		}
		return index + " -= " + Math.abs(step);
	}

	@Override
	public String visitWhile(WhileStmt node)
	{
		if (!node.orElse().isEmpty())
		{
			throw errorReporter.error(node.orElse().get(0), "Cannot handle statement after while");
		}
		return "while (" + translateExpression(node.test()) + ") " + translateBody(node.body(), List.of());
	}

	@Override
	public String visitReturn(ReturnStmt node)
	{
		if (node.value() == null)
		{
			return "return;";
		}
		return "return " + translateExpression(node.value()) + ";";
	}

	@Override
	public String visitBreak(BreakStmt node)
	{
		return "break;";
	}

	@Override
	public String visitContinue(ContinueStmt node)
	{
		return "continue;";
	}

	@Override
	public String visitPass(PassStmt node)
	{
		return "";
	}

	// --- Expressions ---

	@Override
	public String visitBinary(BinaryExpr node)
	{
		String format = BINARY_FORMATS.get(node.operator());
		if (format == null)
		{
			throw errorReporter.error(node, "Unable to handle operator");
		}

		Integer precedence = BINARY_PRECEDENCE.get(node.operator());
		if (precedence == null)
		{
			// Rendered as a call, operands need no grouping
			return String.format(format, translateExpression(node.left()), translateExpression(node.right()));
		}
		return String.format(format, operand(node.left(), precedence, false), operand(node.right(), precedence, true));
	}

	@Override
	public String visitUnary(UnaryExpr node)
	{
		String symbol = UNARY_SYMBOLS.get(node.operator());
		if (symbol == null)
		{
			throw errorReporter.error(node, "Unable to handle operator");
		}
		return symbol + operand(node.operand(), PRECEDENCE_UNARY, true);
	}

	@Override
	public String visitBool(BoolExpr node)
	{
		int precedence = node.operator() == BooleanOperator.AND ? PRECEDENCE_AND : PRECEDENCE_OR;
		String separator = node.operator() == BooleanOperator.AND ? " && " : " || ";

		List<String> values = new ArrayList<>();
		for (Expr value : node.values())
		{
			values.add(operand(value, precedence, false));
		}
		return String.join(separator, values);
	}

	@Override
	public String visitCompare(CompareExpr node)
	{
		for (ComparisonOperator operator : node.operators())
		{
			if (!COMPARISON_SYMBOLS.containsKey(operator))
			{
				throw errorReporter.error(node, "Cannot handle comparison operator");
			}
		}

		// a < b < c becomes a < b && b < c
		List<Expr> values = new ArrayList<>();
		values.add(node.left());
		values.addAll(node.comparators());

		List<String> pairs = new ArrayList<>();
		for (int i = 0; i < node.operators().size(); i++)
		{
			ComparisonOperator operator = node.operators().get(i);
			int precedence = COMPARISON_PRECEDENCE.get(operator);
			pairs.add(operand(values.get(i), precedence, false)
					+ " " + COMPARISON_SYMBOLS.get(operator) + " "
					+ operand(values.get(i + 1), precedence, true));
		}
		return String.join(" && ", pairs);
	}

	@Override
	public String visitCall(CallExpr node)
	{
		if (!node.keywords().isEmpty())
		{
			throw errorReporter.error(node.keywords().get(0), "Cannot handle keyword arguments");
		}

		List<String> arguments = new ArrayList<>();
		for (Expr argument : node.arguments())
		{
			if (argument instanceof StarredExpr)
			{
				throw errorReporter.error(argument, "Cannot handle starred arguments");
			}
			arguments.add(translateExpression(argument));
		}
		return translateExpression(node.function()) + "(" + String.join(", ", arguments) + ")";
	}

	@Override
	public String visitKeywordArg(KeywordArg node)
	{
		throw errorReporter.error(node, "Cannot handle keyword arguments");
	}

	@Override
	public String visitStarred(StarredExpr node)
	{
		throw errorReporter.error(node, "Cannot handle starred arguments");
	}

	@Override
	public String visitAttribute(AttributeExpr node)
	{
		return translateExpression(node.value()) + "." + node.attribute();
	}

	@Override
	public String visitSubscript(SubscriptExpr node)
	{
		if (node.index() instanceof SliceExpr || node.index() instanceof TupleExpr)
		{
			throw errorReporter.error(node.index(), "Can only handle single access slices");
		}
		return translateExpression(node.value()) + "[" + translateExpression(node.index()) + "]";
	}

	@Override
	public String visitSlice(SliceExpr node)
	{
		throw errorReporter.error(node, "Can only handle single access slices");
	}

	@Override
	public String visitTuple(TupleExpr node)
	{
		throw errorReporter.error(node, "Unable to handle node type " + node.getNodeName());
	}

	@Override
	public String visitList(ListExpr node)
	{
		List<String> entries = new ArrayList<>();
		for (Expr element : node.elements())
		{
			entries.add(translateExpression(element));
		}
		return "{" + String.join(", ", entries) + "}";
	}

	@Override
	public String visitName(NameExpr node)
	{
		String name = node.id();
		return closure.getGlobalType(name).map(type -> inDimension ? name : type).orElseGet(() ->
		{
			if (!isKnownName(name))
			{
				throw errorReporter.error(node, "Undefined name: " + name);
			}
			return name;
		});
	}

	private boolean isKnownName(String name)
	{
		return scopes.isDefined(name)
				|| closure.isHelper(name)
				|| ClosureInspector.NAMESPACE_MARKER.equals(name)
				|| ClosureInspector.ALLOWED_BUILTINS.contains(name);
	}

	@Override
	public String visitNumber(NumberLiteral node)
	{
		return node.text();
	}

	@Override
	public String visitBoolean(BooleanLiteral node)
	{
		return node.value() ? "true" : "false";
	}

	@Override
	public String visitNone(NoneLiteral node)
	{
		return "NULL";
	}

	@Override
	public String visitString(StringLiteral node)
	{
		throw errorReporter.error(node, "Unable to handle node type " + node.getNodeName());
	}

	// --- Grouping ---

	/**
	 * Renders an operand, parenthesized if it binds looser than its parent operator. On the
	 * {@code strict} side an operand of equal strength is grouped too, so that
	 * {@code a - (b - c)} keeps its meaning.
	 */
	private String operand(Expr expression, int parentPrecedence, boolean strict)
	{
		String text = translateExpression(expression);
		int precedence = precedenceOf(expression);
		if (precedence < parentPrecedence || (strict && precedence == parentPrecedence))
		{
			return "(" + text + ")";
		}
		return text;
	}

	private static int precedenceOf(Expr expression)
	{
		if (expression instanceof BinaryExpr binary)
		{
			return BINARY_PRECEDENCE.getOrDefault(binary.operator(), PRECEDENCE_ATOM);
		}
		if (expression instanceof UnaryExpr)
		{
			return PRECEDENCE_UNARY;
		}
		if (expression instanceof BoolExpr bool)
		{
			return bool.operator() == BooleanOperator.AND ? PRECEDENCE_AND : PRECEDENCE_OR;
		}
		if (expression instanceof CompareExpr compare)
		{
			if (compare.operators().size() > 1)
			{
				return PRECEDENCE_AND;
			}
			return COMPARISON_PRECEDENCE.getOrDefault(compare.operators().get(0), PRECEDENCE_ATOM);
		}
		return PRECEDENCE_ATOM;
	}

	private static String dottedName(Expr expression)
	{
		if (expression instanceof NameExpr name)
		{
			return name.id();
		}
		if (expression instanceof AttributeExpr attribute)
		{
			String head = dottedName(attribute.value());
			return head == null ? null : head + "." + attribute.attribute();
		}
		return null;
	}
}
