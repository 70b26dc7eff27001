package org.lokray.kernelc.ast.stmt;

import org.lokray.kernelc.ast.SourcePosition;
import org.lokray.kernelc.ast.SyntaxVisitor;
import org.lokray.kernelc.ast.expr.BinaryOperator;
import org.lokray.kernelc.ast.expr.Expr;

public record AugAssignStmt(Expr target, BinaryOperator operator, Expr value, SourcePosition position) implements Stmt
{
	@Override
	public <R> R accept(SyntaxVisitor<R> visitor)
	{
		return visitor.visitAugAssign(this);
	}
}
