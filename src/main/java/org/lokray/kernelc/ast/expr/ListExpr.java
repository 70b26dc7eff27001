package org.lokray.kernelc.ast.expr;

import org.lokray.kernelc.ast.SourcePosition;
import org.lokray.kernelc.ast.SyntaxVisitor;

import java.util.List;

public record ListExpr(List<Expr> elements, SourcePosition position) implements Expr
{
	public ListExpr
	{
		elements = List.copyOf(elements);
	}

	@Override
	public <R> R accept(SyntaxVisitor<R> visitor)
	{
		return visitor.visitList(this);
	}
}
