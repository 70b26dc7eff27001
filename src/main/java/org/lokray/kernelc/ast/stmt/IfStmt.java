package org.lokray.kernelc.ast.stmt;

import org.lokray.kernelc.ast.SourcePosition;
import org.lokray.kernelc.ast.SyntaxVisitor;
import org.lokray.kernelc.ast.expr.Expr;

import java.util.List;

/**
 * Conditional. An {@code elif} is an else-branch holding exactly one {@code IfStmt}.
 */
public record IfStmt(Expr test, List<Stmt> body, List<Stmt> orElse, SourcePosition position) implements Stmt
{
	public IfStmt
	{
		body = List.copyOf(body);
		orElse = List.copyOf(orElse);
	}

	@Override
	public <R> R accept(SyntaxVisitor<R> visitor)
	{
		return visitor.visitIf(this);
	}
}
