package org.lokray.kernelc.ast.expr;

import org.lokray.kernelc.ast.SourcePosition;
import org.lokray.kernelc.ast.SyntaxVisitor;

public record NameExpr(String id, SourcePosition position) implements Expr
{
	@Override
	public <R> R accept(SyntaxVisitor<R> visitor)
	{
		return visitor.visitName(this);
	}
}
