package org.lokray.kernelc.ast.expr;

import org.lokray.kernelc.ast.SourcePosition;
import org.lokray.kernelc.ast.SyntaxVisitor;

import java.util.List;

/**
 * A comparison chain: {@code left ops[0] comparators[0] ops[1] comparators[1] ...}.
 */
public record CompareExpr(Expr left, List<ComparisonOperator> operators, List<Expr> comparators,
						  SourcePosition position) implements Expr
{
	public CompareExpr
	{
		operators = List.copyOf(operators);
		comparators = List.copyOf(comparators);
		if (operators.size() != comparators.size())
		{
			throw new IllegalArgumentException("Comparison needs one operator per comparator");
		}
	}

	@Override
	public <R> R accept(SyntaxVisitor<R> visitor)
	{
		return visitor.visitCompare(this);
	}
}
