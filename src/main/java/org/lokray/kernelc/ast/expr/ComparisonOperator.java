package org.lokray.kernelc.ast.expr;

public enum ComparisonOperator
{
	EQ("=="),
	NOT_EQ("!="),
	LT("<"),
	LT_E("<="),
	GT(">"),
	GT_E(">="),
	IS("is"),
	IS_NOT("is not"),
	IN("in"),
	NOT_IN("not in");

	private final String symbol;

	ComparisonOperator(String symbol)
	{
		this.symbol = symbol;
	}

	public String getSymbol()
	{
		return symbol;
	}

	public static ComparisonOperator fromSymbol(String symbol)
	{
		for (ComparisonOperator op : values())
		{
			if (op.symbol.equals(symbol))
			{
				return op;
			}
		}
		throw new IllegalArgumentException("Unknown comparison operator: " + symbol);
	}
}
