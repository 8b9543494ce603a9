package org.lokray.quasar.ast;

import org.antlr.v4.runtime.Token;
import org.lokray.quasar.semantic.type.NullType;
import org.lokray.quasar.semantic.type.Type;

import java.util.Objects;
import java.util.Optional;

public class ReturnStatement extends Statement
{
	private final ScopeNode scope;
	private final Expression expression;

	/**
	 * @param scope      the procedure (or module) being returned from.
	 * @param expression the returned value, or null for a bare return.
	 */
	public ReturnStatement(CompilationContext context, Token token, ScopeNode scope, Expression expression)
	{
		super(context, token);
		this.scope = Objects.requireNonNull(scope, "scope");
		this.expression = expression;
	}

	public ScopeNode getScope()
	{
		return scope;
	}

	public Optional<Expression> getExpression()
	{
		return Optional.ofNullable(expression);
	}

	@Override
	public Type getType()
	{
		return expression != null ? expression.getType() : NullType.INSTANCE;
	}

	@Override
	public <R, A> R accept(StatementVisitor<R, A> visitor, A arg)
	{
		return visitor.visitReturn(this, arg);
	}
}
