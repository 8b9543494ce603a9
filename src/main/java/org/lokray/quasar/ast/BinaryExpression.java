// File: src/main/java/org/lokray/quasar/ast/BinaryExpression.java
package org.lokray.quasar.ast;

import org.antlr.v4.runtime.Token;
import org.lokray.quasar.semantic.type.PrimitiveType;
import org.lokray.quasar.semantic.type.Type;
import org.lokray.quasar.tac.Operation;

import java.util.Objects;

public class BinaryExpression extends OperatorExpression
{
	private final Expression left;
	private final Expression right;

	public BinaryExpression(CompilationContext context, Token token, Operation operation, Expression left, Expression right)
	{
		super(context, token, operation);
		if (!operation.isBinary())
		{
			throw new IllegalArgumentException("Not a binary operation: " + operation);
		}
		this.left = Objects.requireNonNull(left, "left");
		this.right = Objects.requireNonNull(right, "right");
	}

	public Expression getLeft()
	{
		return left;
	}

	public Expression getRight()
	{
		return right;
	}

	/**
	 * Arithmetic yields an integer, everything else a boolean.
	 */
	@Override
	public Type getType()
	{
		return getOperation().isArithmetic() ? PrimitiveType.INT : PrimitiveType.BOOLEAN;
	}

	@Override
	public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg)
	{
		return visitor.visitBinary(this, arg);
	}
}
