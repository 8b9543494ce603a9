package org.lokray.quasar.ast;

/**
 * Visitor over the expression kinds. {@code A} is an argument threaded through
 * the traversal.
 */
public interface ExpressionVisitor<R, A>
{
	R visitBinary(BinaryExpression expression, A arg);

	R visitUnary(UnaryExpression expression, A arg);

	R visitSpecial(SpecialExpression expression, A arg);

	R visitFunctionCall(FunctionCall expression, A arg);

	R visitDesignator(Designator expression, A arg);

	R visitArrayDesignator(ArrayDesignator expression, A arg);

	R visitConstant(Constant expression, A arg);

	R visitStringConstant(StringConstant expression, A arg);
}
