package org.lokray.kernelc.ast.expr;

public enum BooleanOperator
{
	AND,
	OR
}
