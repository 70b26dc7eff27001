package org.lokray.kernelc.ast.stmt;

import org.lokray.kernelc.ast.SourcePosition;
import org.lokray.kernelc.ast.SyntaxNode;
import org.lokray.kernelc.ast.SyntaxVisitor;
import org.lokray.kernelc.ast.expr.Expr;

/**
 * A single function parameter. {@code annotation} and {@code defaultValue} are null when absent.
 */
public record Parameter(String name, Kind kind, Expr annotation, Expr defaultValue,
						SourcePosition position) implements SyntaxNode
{
	public enum Kind
	{
		POSITIONAL,
		KEYWORD_ONLY,
		VARIADIC,
		KEYWORD_VARIADIC
	}

	public Parameter(String name, Expr annotation, SourcePosition position)
	{
		this(name, Kind.POSITIONAL, annotation, null, position);
	}

	public boolean hasDefaultValue()
	{
		return defaultValue != null;
	}

	@Override
	public <R> R accept(SyntaxVisitor<R> visitor)
	{
		return visitor.visitParameter(this);
	}
}
