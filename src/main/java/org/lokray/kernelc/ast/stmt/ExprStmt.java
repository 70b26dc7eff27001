package org.lokray.kernelc.ast.stmt;

import org.lokray.kernelc.ast.SourcePosition;
import org.lokray.kernelc.ast.SyntaxVisitor;
import org.lokray.kernelc.ast.expr.Expr;

/**
 * An expression evaluated for its effect, usually a call.
 */
public record ExprStmt(Expr value, SourcePosition position) implements Stmt
{
	@Override
	public <R> R accept(SyntaxVisitor<R> visitor)
	{
		return visitor.visitExprStmt(this);
	}
}
