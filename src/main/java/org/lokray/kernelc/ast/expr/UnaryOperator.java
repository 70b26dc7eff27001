package org.lokray.kernelc.ast.expr;

public enum UnaryOperator
{
	INVERT("~"),
	NOT("not"),
	PLUS("+"),
	MINUS("-");

	private final String symbol;

	UnaryOperator(String symbol)
	{
		this.symbol = symbol;
	}

	public String getSymbol()
	{
		return symbol;
	}
}
