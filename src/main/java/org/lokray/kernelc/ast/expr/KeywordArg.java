package org.lokray.kernelc.ast.expr;

import org.lokray.kernelc.ast.SourcePosition;
import org.lokray.kernelc.ast.SyntaxVisitor;

/**
 * A {@code name=value} call argument; {@code name} is null for a {@code **mapping} argument.
 */
public record KeywordArg(String name, Expr value, SourcePosition position) implements Expr
{
	@Override
	public <R> R accept(SyntaxVisitor<R> visitor)
	{
		return visitor.visitKeywordArg(this);
	}
}
