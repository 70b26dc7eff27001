package org.lokray.kernelc.ast.stmt;

import org.lokray.kernelc.ast.SourcePosition;
import org.lokray.kernelc.ast.SyntaxVisitor;
import org.lokray.kernelc.ast.expr.Expr;

import java.util.List;

/**
 * Conditional loop.
 */
public record WhileStmt(Expr test, List<Stmt> body, List<Stmt> orElse, SourcePosition position) implements Stmt
{
	public WhileStmt
	{
		body = List.copyOf(body);
		orElse = List.copyOf(orElse);
	}

	@Override
	public <R> R accept(SyntaxVisitor<R> visitor)
	{
		return visitor.visitWhile(this);
	}
}
