package org.lokray.quasar.ast;

import org.antlr.v4.runtime.Token;
import org.lokray.quasar.semantic.type.PrimitiveType;
import org.lokray.quasar.semantic.type.Type;
import org.lokray.quasar.tac.Operation;

import java.util.Objects;

public class UnaryExpression extends OperatorExpression
{
	private final Expression operand;

	public UnaryExpression(CompilationContext context, Token token, Operation operation, Expression operand)
	{
		super(context, token, operation);
		if (!operation.isUnary())
		{
			throw new IllegalArgumentException("Not a unary operation: " + operation);
		}
		this.operand = Objects.requireNonNull(operand, "operand");
	}

	public Expression getOperand()
	{
		return operand;
	}

	@Override
	public Type getType()
	{
		return getOperation() == Operation.NOT ? PrimitiveType.BOOLEAN : PrimitiveType.INT;
	}

	@Override
	public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg)
	{
		return visitor.visitUnary(this, arg);
	}
}
