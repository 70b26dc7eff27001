package org.lokray.kernelc.util;

import org.lokray.kernelc.ast.SyntaxNode;

/**
 * An unsupported or invalid construct was found while walking the tree. The message is
 * the fully formatted diagnostic.
 */
public class TranslationException extends KernelcException
{
	private final transient Diagnostic diagnostic;
	private final transient SyntaxNode node;

	public TranslationException(Diagnostic diagnostic, SyntaxNode node)
	{
		super(diagnostic.format());
		this.diagnostic = diagnostic;
		this.node = node;
	}

	public Diagnostic getDiagnostic()
	{
		return diagnostic;
	}

	/**
	 * @return The failing node, or null for syntax errors raised before a tree existed.
	 */
	public SyntaxNode getNode()
	{
		return node;
	}
}
