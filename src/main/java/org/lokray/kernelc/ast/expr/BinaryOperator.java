package org.lokray.kernelc.ast.expr;

public enum BinaryOperator
{
	ADD("+"),
	SUB("-"),
	MULT("*"),
	MAT_MULT("@"),
	DIV("/"),
	MOD("%"),
	POW("**"),
	LSHIFT("<<"),
	RSHIFT(">>"),
	BIT_OR("|"),
	BIT_XOR("^"),
	BIT_AND("&"),
	FLOOR_DIV("//");

	private final String symbol;

	BinaryOperator(String symbol)
	{
		this.symbol = symbol;
	}

	public String getSymbol()
	{
		return symbol;
	}

	public static BinaryOperator fromSymbol(String symbol)
	{
		for (BinaryOperator op : values())
		{
			if (op.symbol.equals(symbol))
			{
				return op;
			}
		}
		throw new IllegalArgumentException("Unknown binary operator: " + symbol);
	}
}
