package org.lokray.kernelc.parser;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.lokray.kernelc.ast.SourceModule;
import org.lokray.kernelc.ast.SourcePosition;
import org.lokray.kernelc.ast.expr.*;
import org.lokray.kernelc.ast.stmt.*;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Converts an ANTLR parse tree into {@link org.lokray.kernelc.ast.SyntaxNode}s.
 * Expression rules go through the generated visitor, statements are walked directly.
 */
public class SyntaxTreeBuilder extends KernelParserBaseVisitor<Expr>
{
	public SourceModule build(KernelParser.FileInputContext ctx)
	{
		List<Stmt> body = new ArrayList<>();
		for (KernelParser.StatementContext statement : ctx.statement())
		{
			body.addAll(buildStatement(statement));
		}
		return new SourceModule(body, SourcePosition.of(1, 0));
	}

	// --- Statements ---

	private List<Stmt> buildStatement(KernelParser.StatementContext ctx)
	{
		if (ctx.simpleStatement() != null)
		{
			return buildSimpleStatement(ctx.simpleStatement());
		}
		return List.of(buildCompoundStatement(ctx.compoundStatement()));
	}

	private List<Stmt> buildSimpleStatement(KernelParser.SimpleStatementContext ctx)
	{
		List<Stmt> statements = new ArrayList<>();
		for (KernelParser.SmallStatementContext small : ctx.smallStatement())
		{
			statements.add(buildSmallStatement(small));
		}
		return statements;
	}

	private Stmt buildSmallStatement(KernelParser.SmallStatementContext ctx)
	{
		SourcePosition position = positionOf(ctx);

		if (ctx instanceof KernelParser.PassStatementContext)
		{
			return new PassStmt(position);
		}
		if (ctx instanceof KernelParser.BreakStatementContext)
		{
			return new BreakStmt(position);
		}
		if (ctx instanceof KernelParser.ContinueStatementContext)
		{
			return new ContinueStmt(position);
		}
		if (ctx instanceof KernelParser.ReturnStatementContext ret)
		{
			Expr value = ret.testList() == null ? null : buildTestList(ret.testList());
			return new ReturnStmt(value, position);
		}
		if (ctx instanceof KernelParser.AnnotatedAssignmentContext annotated)
		{
			Expr value = annotated.value == null ? null : buildTestList(annotated.value);
			return new AnnAssignStmt(visit(annotated.target), visit(annotated.annotation), value, position);
		}
		if (ctx instanceof KernelParser.AugmentedAssignmentContext augmented)
		{
			String symbol = augmented.augmentedOperator().getText();
			BinaryOperator operator = BinaryOperator.fromSymbol(symbol.substring(0, symbol.length() - 1));
			return new AugAssignStmt(buildTestList(augmented.augmentedTarget), operator,
					buildTestList(augmented.augmentedValue), position);
		}
		if (ctx instanceof KernelParser.AssignmentContext assignment)
		{
			List<KernelParser.TestListContext> sides = assignment.testList();
			List<Expr> targets = new ArrayList<>();
			for (KernelParser.TestListContext target : sides.subList(0, sides.size() - 1))
			{
				targets.add(buildTestList(target));
			}
			return new AssignStmt(targets, buildTestList(sides.get(sides.size() - 1)), position);
		}
		KernelParser.ExpressionStatementContext expression = (KernelParser.ExpressionStatementContext) ctx;
		return new ExprStmt(buildTestList(expression.testList()), position);
	}

	private Stmt buildCompoundStatement(KernelParser.CompoundStatementContext ctx)
	{
		if (ctx.ifStatement() != null)
		{
			return buildIf(ctx.ifStatement());
		}
		if (ctx.whileStatement() != null)
		{
			return buildWhile(ctx.whileStatement());
		}
		if (ctx.forStatement() != null)
		{
			return buildFor(ctx.forStatement());
		}
		return buildFunctionDefinition(ctx.functionDefinition());
	}

	private Stmt buildIf(KernelParser.IfStatementContext ctx)
	{
		List<KernelParser.TestContext> tests = ctx.test();
		List<KernelParser.SuiteContext> suites = ctx.suite();

		// elif chains nest from the innermost branch outwards
		List<Stmt> orElse = ctx.ELSE() != null ? buildSuite(suites.get(suites.size() - 1)) : List.of();
		for (int i = tests.size() - 1; i >= 1; i--)
		{
			SourcePosition elifPosition = positionOf(ctx.ELIF(i - 1).getSymbol());
			orElse = List.of(new IfStmt(visit(tests.get(i)), buildSuite(suites.get(i)), orElse, elifPosition));
		}
		return new IfStmt(visit(tests.get(0)), buildSuite(suites.get(0)), orElse, positionOf(ctx));
	}

	private Stmt buildWhile(KernelParser.WhileStatementContext ctx)
	{
		List<Stmt> orElse = ctx.ELSE() != null ? buildSuite(ctx.suite(1)) : List.of();
		return new WhileStmt(visit(ctx.test()), buildSuite(ctx.suite(0)), orElse, positionOf(ctx));
	}

	private Stmt buildFor(KernelParser.ForStatementContext ctx)
	{
		List<Stmt> orElse = ctx.ELSE() != null ? buildSuite(ctx.suite(1)) : List.of();
		return new ForStmt(buildExprList(ctx.exprList()), buildTestList(ctx.testList()),
				buildSuite(ctx.suite(0)), orElse, positionOf(ctx.FOR().getSymbol()));
	}

	private Stmt buildFunctionDefinition(KernelParser.FunctionDefinitionContext ctx)
	{
		List<Expr> decorators = new ArrayList<>();
		for (KernelParser.DecoratorContext decorator : ctx.decorator())
		{
			decorators.add(visit(decorator.test()));
		}

		List<Parameter> parameters = new ArrayList<>();
		if (ctx.parameters().parameterList() != null)
		{
			buildParameters(ctx.parameters().parameterList(), parameters);
		}

		Expr returnType = ctx.returnType == null ? null : visit(ctx.returnType);
		return new FunctionDefStmt(ctx.NAME().getText(), parameters, returnType, buildSuite(ctx.suite()),
				decorators, positionOf(ctx.DEF().getSymbol()));
	}

	private void buildParameters(KernelParser.ParameterListContext ctx, List<Parameter> parameters)
	{
		// Everything after * or *args can only be passed by keyword
		boolean keywordOnly = false;
		for (KernelParser.ParameterContext parameter : ctx.parameter())
		{
			SourcePosition position = positionOf(parameter);
			if (parameter instanceof KernelParser.VariadicParameterContext variadic)
			{
				keywordOnly = true;
				if (variadic.NAME() != null)
				{
					parameters.add(new Parameter(variadic.NAME().getText(), Parameter.Kind.VARIADIC,
							optional(variadic.annotation), null, position));
				}
			}
			else if (parameter instanceof KernelParser.KeywordVariadicParameterContext keywordVariadic)
			{
				parameters.add(new Parameter(keywordVariadic.NAME().getText(), Parameter.Kind.KEYWORD_VARIADIC,
						optional(keywordVariadic.annotation), null, position));
			}
			else
			{
				KernelParser.NamedParameterContext named = (KernelParser.NamedParameterContext) parameter;
				Parameter.Kind kind = keywordOnly ? Parameter.Kind.KEYWORD_ONLY : Parameter.Kind.POSITIONAL;
				parameters.add(new Parameter(named.NAME().getText(), kind,
						optional(named.annotation), optional(named.defaultValue), position));
			}
		}
	}

	private List<Stmt> buildSuite(KernelParser.SuiteContext ctx)
	{
		if (ctx.simpleStatement() != null)
		{
			return buildSimpleStatement(ctx.simpleStatement());
		}
		List<Stmt> statements = new ArrayList<>();
		for (KernelParser.StatementContext statement : ctx.statement())
		{
			statements.addAll(buildStatement(statement));
		}
		return statements;
	}

	// --- Expression lists ---

	private Expr buildTestList(KernelParser.TestListContext ctx)
	{
		List<Expr> elements = new ArrayList<>();
		for (KernelParser.TestContext test : ctx.test())
		{
			elements.add(visit(test));
		}
		if (elements.size() == 1 && ctx.COMMA().isEmpty())
		{
			return elements.get(0);
		}
		return new TupleExpr(elements, positionOf(ctx));
	}

	private Expr buildExprList(KernelParser.ExprListContext ctx)
	{
		List<Expr> elements = new ArrayList<>();
		for (KernelParser.ExprContext expr : ctx.expr())
		{
			elements.add(visit(expr));
		}
		if (elements.size() == 1 && ctx.COMMA().isEmpty())
		{
			return elements.get(0);
		}
		return new TupleExpr(elements, positionOf(ctx));
	}

	// --- Expressions ---

	@Override
	public Expr visitTest(KernelParser.TestContext ctx)
	{
		return visit(ctx.orTest());
	}

	@Override
	public Expr visitOrTest(KernelParser.OrTestContext ctx)
	{
		if (ctx.andTest().size() == 1)
		{
			return visit(ctx.andTest(0));
		}
		List<Expr> values = new ArrayList<>();
		ctx.andTest().forEach(operand -> values.add(visit(operand)));
		return new BoolExpr(BooleanOperator.OR, values, positionOf(ctx));
	}

	@Override
	public Expr visitAndTest(KernelParser.AndTestContext ctx)
	{
		if (ctx.notTest().size() == 1)
		{
			return visit(ctx.notTest(0));
		}
		List<Expr> values = new ArrayList<>();
		ctx.notTest().forEach(operand -> values.add(visit(operand)));
		return new BoolExpr(BooleanOperator.AND, values, positionOf(ctx));
	}

	@Override
	public Expr visitNotTest(KernelParser.NotTestContext ctx)
	{
		if (ctx.NOT() != null)
		{
			return new UnaryExpr(UnaryOperator.NOT, visit(ctx.notTest()), positionOf(ctx));
		}
		return visit(ctx.comparison());
	}

	@Override
	public Expr visitComparison(KernelParser.ComparisonContext ctx)
	{
		Expr left = visit(ctx.expr(0));
		if (ctx.expr().size() == 1)
		{
			return left;
		}

		List<ComparisonOperator> operators = new ArrayList<>();
		for (KernelParser.ComparisonOperatorContext operator : ctx.comparisonOperator())
		{
			operators.add(ComparisonOperator.fromSymbol(comparisonSymbol(operator)));
		}
		List<Expr> comparators = new ArrayList<>();
		for (KernelParser.ExprContext comparator : ctx.expr().subList(1, ctx.expr().size()))
		{
			comparators.add(visit(comparator));
		}
		return new CompareExpr(left, operators, comparators, positionOf(ctx));
	}

	// "not in" and "is not" are two tokens, getText() would glue them together
	private static String comparisonSymbol(KernelParser.ComparisonOperatorContext ctx)
	{
		List<String> words = new ArrayList<>();
		for (int i = 0; i < ctx.getChildCount(); i++)
		{
			words.add(ctx.getChild(i).getText());
		}
		return String.join(" ", words);
	}

	@Override
	public Expr visitExpr(KernelParser.ExprContext ctx)
	{
		return foldBinary(ctx, this::visit);
	}

	@Override
	public Expr visitXorExpr(KernelParser.XorExprContext ctx)
	{
		return foldBinary(ctx, this::visit);
	}

	@Override
	public Expr visitAndExpr(KernelParser.AndExprContext ctx)
	{
		return foldBinary(ctx, this::visit);
	}

	@Override
	public Expr visitShiftExpr(KernelParser.ShiftExprContext ctx)
	{
		return foldBinary(ctx, this::visit);
	}

	@Override
	public Expr visitArithExpr(KernelParser.ArithExprContext ctx)
	{
		return foldBinary(ctx, this::visit);
	}

	@Override
	public Expr visitTerm(KernelParser.TermContext ctx)
	{
		return foldBinary(ctx, this::visit);
	}

	/**
	 * Folds {@code operand (op operand)*} to the left, as the source language associates it.
	 */
	private Expr foldBinary(ParserRuleContext ctx, Function<ParseTree, Expr> operand)
	{
		Expr result = operand.apply(ctx.getChild(0));
		for (int i = 1; i + 1 < ctx.getChildCount(); i += 2)
		{
			BinaryOperator operator = BinaryOperator.fromSymbol(ctx.getChild(i).getText());
			result = new BinaryExpr(result, operator, operand.apply(ctx.getChild(i + 1)), positionOf(ctx));
		}
		return result;
	}

	@Override
	public Expr visitFactor(KernelParser.FactorContext ctx)
	{
		if (ctx.power() != null)
		{
			return visit(ctx.power());
		}

		UnaryOperator operator = switch (ctx.getStart().getType())
		{
			case KernelParser.ADD -> UnaryOperator.PLUS;
			case KernelParser.MINUS -> UnaryOperator.MINUS;
			default -> UnaryOperator.INVERT;
		};
		return new UnaryExpr(operator, visit(ctx.factor()), positionOf(ctx));
	}

	@Override
	public Expr visitPower(KernelParser.PowerContext ctx)
	{
		Expr base = visit(ctx.atomExpression());
		if (ctx.factor() == null)
		{
			return base;
		}
		return new BinaryExpr(base, BinaryOperator.POW, visit(ctx.factor()), positionOf(ctx));
	}

	@Override
	public Expr visitAtomExpression(KernelParser.AtomExpressionContext ctx)
	{
		SourcePosition position = positionOf(ctx);
		Expr result = visit(ctx.atom());

		for (KernelParser.TrailerContext trailer : ctx.trailer())
		{
			if (trailer instanceof KernelParser.CallTrailerContext call)
			{
				result = buildCall(result, call.argumentList(), position);
			}
			else if (trailer instanceof KernelParser.SubscriptTrailerContext subscript)
			{
				result = new SubscriptExpr(result, buildSubscriptList(subscript.subscriptList()), position);
			}
			else
			{
				KernelParser.AttributeTrailerContext attribute = (KernelParser.AttributeTrailerContext) trailer;
				result = new AttributeExpr(result, attribute.NAME().getText(), position);
			}
		}
		return result;
	}

	private Expr buildCall(Expr function, KernelParser.ArgumentListContext ctx, SourcePosition position)
	{
		List<Expr> arguments = new ArrayList<>();
		List<KeywordArg> keywords = new ArrayList<>();
		if (ctx != null)
		{
			for (KernelParser.ArgumentContext argument : ctx.argument())
			{
				SourcePosition argumentPosition = positionOf(argument);
				if (argument instanceof KernelParser.KeywordArgumentContext keyword)
				{
					keywords.add(new KeywordArg(keyword.NAME().getText(), visit(keyword.test()), argumentPosition));
				}
				else if (argument instanceof KernelParser.StarredArgumentContext starred)
				{
					arguments.add(new StarredExpr(visit(starred.test()), argumentPosition));
				}
				else if (argument instanceof KernelParser.DoubleStarredArgumentContext doubleStarred)
				{
					keywords.add(new KeywordArg(null, visit(doubleStarred.test()), argumentPosition));
				}
				else
				{
					arguments.add(visit(((KernelParser.PositionalArgumentContext) argument).test()));
				}
			}
		}
		return new CallExpr(function, arguments, keywords, position);
	}

	private Expr buildSubscriptList(KernelParser.SubscriptListContext ctx)
	{
		List<Expr> elements = new ArrayList<>();
		for (KernelParser.SubscriptContext subscript : ctx.subscript())
		{
			if (subscript instanceof KernelParser.SliceSubscriptContext slice)
			{
				elements.add(new SliceExpr(optional(slice.lower), optional(slice.upper), optional(slice.step),
						positionOf(slice)));
			}
			else
			{
				elements.add(visit(((KernelParser.IndexSubscriptContext) subscript).test()));
			}
		}
		if (elements.size() == 1 && ctx.COMMA().isEmpty())
		{
			return elements.get(0);
		}
		return new TupleExpr(elements, positionOf(ctx));
	}

	// --- Atoms ---

	@Override
	public Expr visitParenthesizedAtom(KernelParser.ParenthesizedAtomContext ctx)
	{
		if (ctx.testList() == null)
		{
			return new TupleExpr(List.of(), positionOf(ctx));
		}
		return buildTestList(ctx.testList());
	}

	@Override
	public Expr visitListAtom(KernelParser.ListAtomContext ctx)
	{
		List<Expr> elements = new ArrayList<>();
		if (ctx.testList() != null)
		{
			ctx.testList().test().forEach(test -> elements.add(visit(test)));
		}
		return new ListExpr(elements, positionOf(ctx));
	}

	@Override
	public Expr visitNameAtom(KernelParser.NameAtomContext ctx)
	{
		return new NameExpr(ctx.NAME().getText(), positionOf(ctx));
	}

	@Override
	public Expr visitIntegerAtom(KernelParser.IntegerAtomContext ctx)
	{
		return NumberLiteral.parse(ctx.INTEGER().getText(), positionOf(ctx));
	}

	@Override
	public Expr visitFloatAtom(KernelParser.FloatAtomContext ctx)
	{
		return NumberLiteral.parse(ctx.FLOAT_NUMBER().getText(), positionOf(ctx));
	}

	@Override
	public Expr visitStringAtom(KernelParser.StringAtomContext ctx)
	{
		StringBuilder value = new StringBuilder();
		for (TerminalNode string : ctx.STRING())
		{
			value.append(unquote(string.getText()));
		}
		return new StringLiteral(value.toString(), positionOf(ctx));
	}

	@Override
	public Expr visitNoneAtom(KernelParser.NoneAtomContext ctx)
	{
		return new NoneLiteral(positionOf(ctx));
	}

	@Override
	public Expr visitTrueAtom(KernelParser.TrueAtomContext ctx)
	{
		return new BooleanLiteral(true, positionOf(ctx));
	}

	@Override
	public Expr visitFalseAtom(KernelParser.FalseAtomContext ctx)
	{
		return new BooleanLiteral(false, positionOf(ctx));
	}

	// --- Helpers ---

	private Expr optional(KernelParser.TestContext ctx)
	{
		return ctx == null ? null : visit(ctx);
	}

	private static String unquote(String literal)
	{
		int quote = literal.startsWith("\"\"\"") || literal.startsWith("'''") ? 3 : 1;
		return literal.substring(quote, literal.length() - quote);
	}

	private static SourcePosition positionOf(ParserRuleContext ctx)
	{
		return positionOf(ctx.getStart());
	}

	private static SourcePosition positionOf(Token token)
	{
		return SourcePosition.of(token.getLine(), token.getCharPositionInLine());
	}
}
