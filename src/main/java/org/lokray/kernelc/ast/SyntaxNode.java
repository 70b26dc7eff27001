package org.lokray.kernelc.ast;

/**
 * A node of the kernel source tree. The set of node kinds is closed: every kind
 * has a matching method on {@link SyntaxVisitor}.
 */
public interface SyntaxNode
{
	SourcePosition position();

	<R> R accept(SyntaxVisitor<R> visitor);

	default String getNodeName()
	{
		return getClass().getSimpleName();
	}
}
