package org.lokray.kernelc.ast.expr;

import org.lokray.kernelc.ast.SourcePosition;
import org.lokray.kernelc.ast.SyntaxVisitor;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * A numeric literal held in canonical text form: integers in plain decimal, floats in
 * shortest form with either a fractional part ({@code 1.0}) or an exponent ({@code 1e-05}).
 */
public record NumberLiteral(String text, boolean integral, SourcePosition position) implements Expr
{
	public static NumberLiteral ofInteger(BigInteger value, SourcePosition position)
	{
		return new NumberLiteral(value.toString(), true, position);
	}

	public static NumberLiteral ofInteger(long value, SourcePosition position)
	{
		return ofInteger(BigInteger.valueOf(value), position);
	}

	public static NumberLiteral ofFloat(double value, SourcePosition position)
	{
		return new NumberLiteral(canonicalFloat(value), false, position);
	}

	/**
	 * Parses literal source text, accepting digit separators and {@code 0x}/{@code 0o}/{@code 0b} prefixes.
	 */
	public static NumberLiteral parse(String source, SourcePosition position)
	{
		String digits = source.replace("_", "");
		String lower = digits.toLowerCase();
		if (lower.startsWith("0x"))
		{
			return ofInteger(new BigInteger(digits.substring(2), 16), position);
		}
		if (lower.startsWith("0o"))
		{
			return ofInteger(new BigInteger(digits.substring(2), 8), position);
		}
		if (lower.startsWith("0b"))
		{
			return ofInteger(new BigInteger(digits.substring(2), 2), position);
		}
		if (lower.contains(".") || lower.contains("e"))
		{
			return ofFloat(Double.parseDouble(digits), position);
		}
		return ofInteger(new BigInteger(digits), position);
	}

	static String canonicalFloat(double value)
	{
		if (Double.isNaN(value))
		{
			return "nan";
		}
		if (Double.isInfinite(value))
		{
			return value > 0 ? "inf" : "-inf";
		}
		if (value == 0.0)
		{
			return (1.0 / value) < 0 ? "-0.0" : "0.0";
		}

		BigDecimal decimal = new BigDecimal(Double.toString(value)).stripTrailingZeros();
		String sign = decimal.signum() < 0 ? "-" : "";
		String unscaled = decimal.unscaledValue().abs().toString();
		int exponent = unscaled.length() - 1 - decimal.scale();

		if (exponent >= -4 && exponent < 16)
		{
			String plain = decimal.abs().toPlainString();
			return sign + (plain.contains(".") ? plain : plain + ".0");
		}

		String mantissa = unscaled.length() > 1 ? unscaled.charAt(0) + "." + unscaled.substring(1) : unscaled;
		String exponentSign = exponent < 0 ? "-" : "+";
		return String.format("%s%se%s%02d", sign, mantissa, exponentSign, Math.abs(exponent));
	}

	@Override
	public <R> R accept(SyntaxVisitor<R> visitor)
	{
		return visitor.visitNumber(this);
	}
}
