package org.lokray.quasar.ast;

/**
 * Visitor over the statement kinds. {@code A} is an argument threaded through
 * the traversal.
 */
public interface StatementVisitor<R, A>
{
	R visitAssign(AssignStatement statement, A arg);

	R visitCall(CallStatement statement, A arg);

	R visitReturn(ReturnStatement statement, A arg);

	R visitIf(IfStatement statement, A arg);

	R visitWhile(WhileStatement statement, A arg);

	R visitBreak(BreakStatement statement, A arg);
}
