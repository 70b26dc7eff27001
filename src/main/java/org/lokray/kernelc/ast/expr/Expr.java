package org.lokray.kernelc.ast.expr;

import org.lokray.kernelc.ast.SyntaxNode;

public interface Expr extends SyntaxNode
{
}
