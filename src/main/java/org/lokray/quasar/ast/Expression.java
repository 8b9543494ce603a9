package org.lokray.quasar.ast;

import org.antlr.v4.runtime.Token;
import org.lokray.quasar.semantic.type.Type;

/**
 * An expression. Its type is derived from the operator and the operand types;
 * ill-typed expressions report {@link org.lokray.quasar.semantic.type.ErrorType}.
 */
public abstract class Expression extends AstNode
{
	protected Expression(CompilationContext context, Token token)
	{
		super(context, token);
	}

	@Override
	public abstract Type getType();

	public abstract <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg);
}
