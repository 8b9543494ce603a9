package org.lokray.quasar.ast;

import org.antlr.v4.runtime.Token;
import org.lokray.quasar.semantic.type.Type;

import java.util.Objects;

public class AssignStatement extends Statement
{
	private final Designator lhs;
	private final Expression rhs;

	public AssignStatement(CompilationContext context, Token token, Designator lhs, Expression rhs)
	{
		super(context, token);
		this.lhs = Objects.requireNonNull(lhs, "lhs");
		this.rhs = Objects.requireNonNull(rhs, "rhs");
	}

	public Designator getLhs()
	{
		return lhs;
	}

	public Expression getRhs()
	{
		return rhs;
	}

	@Override
	public Type getType()
	{
		return lhs.getType();
	}

	@Override
	public <R, A> R accept(StatementVisitor<R, A> visitor, A arg)
	{
		return visitor.visitAssign(this, arg);
	}
}
