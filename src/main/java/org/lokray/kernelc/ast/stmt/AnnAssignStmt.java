package org.lokray.kernelc.ast.stmt;

import org.lokray.kernelc.ast.SourcePosition;
import org.lokray.kernelc.ast.SyntaxVisitor;
import org.lokray.kernelc.ast.expr.Expr;

/**
 * Annotated assignment ({@code x: int = 1}); {@code value} is null for a bare declaration.
 */
public record AnnAssignStmt(Expr target, Expr annotation, Expr value, SourcePosition position) implements Stmt
{
	@Override
	public <R> R accept(SyntaxVisitor<R> visitor)
	{
		return visitor.visitAnnAssign(this);
	}
}
