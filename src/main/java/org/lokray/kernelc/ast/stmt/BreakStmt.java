package org.lokray.kernelc.ast.stmt;

import org.lokray.kernelc.ast.SourcePosition;
import org.lokray.kernelc.ast.SyntaxVisitor;

public record BreakStmt(SourcePosition position) implements Stmt
{
	@Override
	public <R> R accept(SyntaxVisitor<R> visitor)
	{
		return visitor.visitBreak(this);
	}
}
