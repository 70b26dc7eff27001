package org.lokray.kernelc.ast.stmt;

import org.lokray.kernelc.ast.SourcePosition;
import org.lokray.kernelc.ast.SyntaxVisitor;
import org.lokray.kernelc.ast.expr.Expr;

import java.util.List;

/**
 * A function definition.
 *
 * @param name       The function name.
 * @param parameters Parameters in declaration order.
 * @param returnType The return annotation, or {@code null} if the source had none.
 * @param body       The statements of the function body.
 * @param decorators Decorator expressions in source order.
 */
public record FunctionDefStmt(String name, List<Parameter> parameters, Expr returnType, List<Stmt> body,
							  List<Expr> decorators, SourcePosition position) implements Stmt
{
	public FunctionDefStmt
	{
		parameters = List.copyOf(parameters);
		body = List.copyOf(body);
		decorators = List.copyOf(decorators);
	}

	@Override
	public <R> R accept(SyntaxVisitor<R> visitor)
	{
		return visitor.visitFunctionDef(this);
	}
}
