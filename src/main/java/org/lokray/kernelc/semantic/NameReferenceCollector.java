package org.lokray.kernelc.semantic;

import org.lokray.kernelc.ast.SourceModule;
import org.lokray.kernelc.ast.SyntaxNode;
import org.lokray.kernelc.ast.SyntaxVisitor;
import org.lokray.kernelc.ast.expr.*;
import org.lokray.kernelc.ast.stmt.*;
import org.lokray.kernelc.semantic.type.TypeAnnotationResolver;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds the non-local names a function body reads, in order of first use.
 * <p>
 * A name bound anywhere in the function (parameter, assignment target, loop index, nested
 * definition) is local everywhere in it. Annotations, the return type and decorators of
 * the function itself are not part of its body; only the array dimensions inside its
 * annotations are read as names.
 */
public class NameReferenceCollector implements SyntaxVisitor<Void>
{
	private final Set<String> loaded = new LinkedHashSet<>();
	private final Set<String> bound = new HashSet<>();

	private NameReferenceCollector()
	{
	}

	public static List<String> collect(FunctionDefStmt function)
	{
		NameReferenceCollector collector = new NameReferenceCollector();
		for (Parameter parameter : function.parameters())
		{
			collector.bound.add(parameter.name());
			collector.visitDimensions(parameter.annotation());
		}
		collector.visitAll(function.body());
		return collector.loaded.stream()
				.filter(name -> !collector.bound.contains(name))
				.toList();
	}

	private void visit(SyntaxNode node)
	{
		if (node != null)
		{
			node.accept(this);
		}
	}

	private void visitAll(List<? extends SyntaxNode> nodes)
	{
		for (SyntaxNode node : nodes)
		{
			visit(node);
		}
	}

	// List[T, d1, ...] reads d1..dn, possibly under qualifier wrappers
	private void visitDimensions(Expr annotation)
	{
		if (!(annotation instanceof SubscriptExpr subscript))
		{
			return;
		}
		boolean list = subscript.value() instanceof NameExpr head && TypeAnnotationResolver.LIST_GENERIC.equals(head.id());
		if (list && subscript.index() instanceof TupleExpr tuple && !tuple.elements().isEmpty())
		{
			visitDimensions(tuple.elements().get(0));
			visitAll(tuple.elements().subList(1, tuple.elements().size()));
		}
		else
		{
			visitDimensions(subscript.index());
		}
	}

	private void bind(Expr target)
	{
		if (target instanceof NameExpr name)
		{
			bound.add(name.id());
		}
		else if (target instanceof TupleExpr tuple)
		{
			tuple.elements().forEach(this::bind);
		}
		else if (target instanceof ListExpr list)
		{
			list.elements().forEach(this::bind);
		}
		else if (target instanceof StarredExpr starred)
		{
			bind(starred.value());
		}
		else
		{
			// Subscript and attribute targets read their base
			visit(target);
		}
	}

	@Override
	public Void visitModule(SourceModule node)
	{
		visitAll(node.body());
		return null;
	}

	@Override
	public Void visitFunctionDef(FunctionDefStmt node)
	{
		// A nested definition binds its name here; its body has its own closure
		bound.add(node.name());
		visitAll(node.decorators());
		for (Parameter parameter : node.parameters())
		{
			visit(parameter.defaultValue());
		}
		return null;
	}

	@Override
	public Void visitParameter(Parameter node)
	{
		return null;
	}

	@Override
	public Void visitAssign(AssignStmt node)
	{
		node.targets().forEach(this::bind);
		visit(node.value());
		return null;
	}

	@Override
	public Void visitAnnAssign(AnnAssignStmt node)
	{
		bind(node.target());
		visitDimensions(node.annotation());
		visit(node.value());
		return null;
	}

	@Override
	public Void visitAugAssign(AugAssignStmt node)
	{
		bind(node.target());
		visit(node.value());
		return null;
	}

	@Override
	public Void visitExprStmt(ExprStmt node)
	{
		visit(node.value());
		return null;
	}

	@Override
	public Void visitIf(IfStmt node)
	{
		visit(node.test());
		visitAll(node.body());
		visitAll(node.orElse());
		return null;
	}

	@Override
	public Void visitFor(ForStmt node)
	{
		bind(node.target());
		visit(node.iterable());
		visitAll(node.body());
		visitAll(node.orElse());
		return null;
	}

	@Override
	public Void visitWhile(WhileStmt node)
	{
		visit(node.test());
		visitAll(node.body());
		visitAll(node.orElse());
		return null;
	}

	@Override
	public Void visitReturn(ReturnStmt node)
	{
		visit(node.value());
		return null;
	}

	@Override
	public Void visitBreak(BreakStmt node)
	{
		return null;
	}

	@Override
	public Void visitContinue(ContinueStmt node)
	{
		return null;
	}

	@Override
	public Void visitPass(PassStmt node)
	{
		return null;
	}

	@Override
	public Void visitBinary(BinaryExpr node)
	{
		visit(node.left());
		visit(node.right());
		return null;
	}

	@Override
	public Void visitUnary(UnaryExpr node)
	{
		visit(node.operand());
		return null;
	}

	@Override
	public Void visitBool(BoolExpr node)
	{
		visitAll(node.values());
		return null;
	}

	@Override
	public Void visitCompare(CompareExpr node)
	{
		visit(node.left());
		visitAll(node.comparators());
		return null;
	}

	@Override
	public Void visitCall(CallExpr node)
	{
		visit(node.function());
		visitAll(node.arguments());
		visitAll(node.keywords());
		return null;
	}

	@Override
	public Void visitKeywordArg(KeywordArg node)
	{
		visit(node.value());
		return null;
	}

	@Override
	public Void visitStarred(StarredExpr node)
	{
		visit(node.value());
		return null;
	}

	@Override
	public Void visitAttribute(AttributeExpr node)
	{
		visit(node.value());
		return null;
	}

	@Override
	public Void visitSubscript(SubscriptExpr node)
	{
		visit(node.value());
		visit(node.index());
		return null;
	}

	@Override
	public Void visitSlice(SliceExpr node)
	{
		visit(node.lower());
		visit(node.upper());
		visit(node.step());
		return null;
	}

	@Override
	public Void visitTuple(TupleExpr node)
	{
		visitAll(node.elements());
		return null;
	}

	@Override
	public Void visitList(ListExpr node)
	{
		visitAll(node.elements());
		return null;
	}

	@Override
	public Void visitName(NameExpr node)
	{
		loaded.add(node.id());
		return null;
	}

	@Override
	public Void visitNumber(NumberLiteral node)
	{
		return null;
	}

	@Override
	public Void visitBoolean(BooleanLiteral node)
	{
		return null;
	}

	@Override
	public Void visitNone(NoneLiteral node)
	{
		return null;
	}

	@Override
	public Void visitString(StringLiteral node)
	{
		return null;
	}
}
