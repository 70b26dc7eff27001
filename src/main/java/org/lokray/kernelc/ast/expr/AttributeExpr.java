package org.lokray.kernelc.ast.expr;

import org.lokray.kernelc.ast.SourcePosition;
import org.lokray.kernelc.ast.SyntaxVisitor;

/**
 * Dotted member access, {@code value.attribute}.
 */
public record AttributeExpr(Expr value, String attribute, SourcePosition position) implements Expr
{
	@Override
	public <R> R accept(SyntaxVisitor<R> visitor)
	{
		return visitor.visitAttribute(this);
	}
}
