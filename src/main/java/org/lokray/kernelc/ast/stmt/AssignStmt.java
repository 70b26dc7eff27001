package org.lokray.kernelc.ast.stmt;

import org.lokray.kernelc.ast.SourcePosition;
import org.lokray.kernelc.ast.SyntaxVisitor;
import org.lokray.kernelc.ast.expr.Expr;

import java.util.List;

/**
 * Plain assignment. {@code a = b = 1} has two targets.
 */
public record AssignStmt(List<Expr> targets, Expr value, SourcePosition position) implements Stmt
{
	public AssignStmt
	{
		targets = List.copyOf(targets);
	}

	@Override
	public <R> R accept(SyntaxVisitor<R> visitor)
	{
		return visitor.visitAssign(this);
	}
}
