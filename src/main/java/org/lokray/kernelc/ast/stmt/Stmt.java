package org.lokray.kernelc.ast.stmt;

import org.lokray.kernelc.ast.SyntaxNode;

public interface Stmt extends SyntaxNode
{
}
