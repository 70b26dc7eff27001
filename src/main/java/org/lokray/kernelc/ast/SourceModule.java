package org.lokray.kernelc.ast;

import org.lokray.kernelc.ast.stmt.Stmt;

import java.util.List;

/**
 * Root of a parsed source file: a flat list of top-level statements.
 */
public record SourceModule(List<Stmt> body, SourcePosition position) implements SyntaxNode
{
	public SourceModule
	{
		body = List.copyOf(body);
	}

	public SourceModule(List<Stmt> body)
	{
		this(body, SourcePosition.of(1, 0));
	}

	@Override
	public <R> R accept(SyntaxVisitor<R> visitor)
	{
		return visitor.visitModule(this);
	}
}
