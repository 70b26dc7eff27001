package org.lokray.kernelc.ast;

import org.lokray.kernelc.ast.expr.*;
import org.lokray.kernelc.ast.stmt.*;

/**
 * One method per node kind. Implementations are exhaustive by construction.
 *
 * @param <R> The result of visiting a node.
 */
public interface SyntaxVisitor<R>
{
	R visitModule(SourceModule node);

	// --- Statements ---

	R visitFunctionDef(FunctionDefStmt node);

	R visitParameter(Parameter node);

	R visitAssign(AssignStmt node);

	R visitAnnAssign(AnnAssignStmt node);

	R visitAugAssign(AugAssignStmt node);

	R visitExprStmt(ExprStmt node);

	R visitIf(IfStmt node);

	R visitFor(ForStmt node);

	R visitWhile(WhileStmt node);

	R visitReturn(ReturnStmt node);

	R visitBreak(BreakStmt node);

	R visitContinue(ContinueStmt node);

	R visitPass(PassStmt node);

	// --- Expressions ---

	R visitBinary(BinaryExpr node);

	R visitUnary(UnaryExpr node);

	R visitBool(BoolExpr node);

	R visitCompare(CompareExpr node);

	R visitCall(CallExpr node);

	R visitKeywordArg(KeywordArg node);

	R visitStarred(StarredExpr node);

	R visitAttribute(AttributeExpr node);

	R visitSubscript(SubscriptExpr node);

	R visitSlice(SliceExpr node);

	R visitTuple(TupleExpr node);

	R visitList(ListExpr node);

	R visitName(NameExpr node);

	R visitNumber(NumberLiteral node);

	R visitBoolean(BooleanLiteral node);

	R visitNone(NoneLiteral node);

	R visitString(StringLiteral node);
}
