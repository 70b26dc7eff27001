package org.lokray.kernelc.ast.expr;

import org.lokray.kernelc.ast.SourcePosition;
import org.lokray.kernelc.ast.SyntaxVisitor;

import java.util.List;

/**
 * A call. Positional arguments (including starred ones) keep their order; keyword
 * arguments are kept apart.
 */
public record CallExpr(Expr function, List<Expr> arguments, List<KeywordArg> keywords,
					   SourcePosition position) implements Expr
{
	public CallExpr
	{
		arguments = List.copyOf(arguments);
		keywords = List.copyOf(keywords);
	}

	public CallExpr(Expr function, List<Expr> arguments, SourcePosition position)
	{
		this(function, arguments, List.of(), position);
	}

	@Override
	public <R> R accept(SyntaxVisitor<R> visitor)
	{
		return visitor.visitCall(this);
	}
}
