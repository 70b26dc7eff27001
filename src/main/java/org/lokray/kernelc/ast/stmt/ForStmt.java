package org.lokray.kernelc.ast.stmt;

import org.lokray.kernelc.ast.SourcePosition;
import org.lokray.kernelc.ast.SyntaxVisitor;
import org.lokray.kernelc.ast.expr.Expr;

import java.util.List;

/**
 * Counted loop over an iterable.
 */
public record ForStmt(Expr target, Expr iterable, List<Stmt> body, List<Stmt> orElse,
					  SourcePosition position) implements Stmt
{
	public ForStmt
	{
		body = List.copyOf(body);
		orElse = List.copyOf(orElse);
	}

	@Override
	public <R> R accept(SyntaxVisitor<R> visitor)
	{
		return visitor.visitFor(this);
	}
}
