package org.lokray.kernelc.ast.expr;

import org.lokray.kernelc.ast.SourcePosition;
import org.lokray.kernelc.ast.SyntaxVisitor;

import java.util.List;

/**
 * Short-circuit {@code and}/{@code or} over two or more operands.
 */
public record BoolExpr(BooleanOperator operator, List<Expr> values, SourcePosition position) implements Expr
{
	public BoolExpr
	{
		values = List.copyOf(values);
	}

	@Override
	public <R> R accept(SyntaxVisitor<R> visitor)
	{
		return visitor.visitBool(this);
	}
}
