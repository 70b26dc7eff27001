package org.lokray.kernelc.ast.expr;

import org.lokray.kernelc.ast.SourcePosition;
import org.lokray.kernelc.ast.SyntaxVisitor;

/**
 * A {@code lower:upper:step} index; each part may be null.
 */
public record SliceExpr(Expr lower, Expr upper, Expr step, SourcePosition position) implements Expr
{
	@Override
	public <R> R accept(SyntaxVisitor<R> visitor)
	{
		return visitor.visitSlice(this);
	}
}
