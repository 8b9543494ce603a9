// File: src/main/java/org/lokray/quasar/ast/SpecialExpression.java
package org.lokray.quasar.ast;

import org.antlr.v4.runtime.Token;
import org.lokray.quasar.semantic.type.ErrorType;
import org.lokray.quasar.semantic.type.PointerType;
import org.lokray.quasar.semantic.type.Type;
import org.lokray.quasar.semantic.type.TypeManager;
import org.lokray.quasar.tac.Operation;

import java.util.Objects;

/**
 * Address-of, dereference and cast. Address-of is inserted by the parser when
 * an array is passed by reference.
 */
public class SpecialExpression extends OperatorExpression
{
	private final Expression operand;
	private final Type castType;

	public SpecialExpression(CompilationContext context, Token token, Operation operation, Expression operand)
	{
		this(context, token, operation, operand, null);
	}

	/**
	 * @param castType target type of a cast; must be null for the other operations.
	 */
	public SpecialExpression(CompilationContext context, Token token, Operation operation, Expression operand, Type castType)
	{
		super(context, token, operation);
		if (!operation.isSpecial())
		{
			throw new IllegalArgumentException("Not a special operation: " + operation);
		}
		if ((operation == Operation.CAST) != (castType != null))
		{
			throw new IllegalArgumentException("A target type is required for casts and only for casts.");
		}
		this.operand = Objects.requireNonNull(operand, "operand");
		this.castType = castType;
	}

	public Expression getOperand()
	{
		return operand;
	}

	@Override
	public Type getType()
	{
		switch (getOperation())
		{
			case ADDRESS:
				return TypeManager.getPointer(operand.getType());
			case DEREF:
				if (operand.getType() instanceof PointerType pointer)
				{
					return pointer.getBaseType();
				}
				return ErrorType.INSTANCE;
			default:
				return castType;
		}
	}

	@Override
	public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg)
	{
		return visitor.visitSpecial(this, arg);
	}
}
