package org.lokray.quasar.ast;

import org.antlr.v4.runtime.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class WhileStatement extends Statement
{
	private final Expression condition;
	private final List<Statement> body;

	public WhileStatement(CompilationContext context, Token token, Expression condition, List<Statement> body)
	{
		super(context, token);
		this.condition = Objects.requireNonNull(condition, "condition");
		this.body = body == null ? new ArrayList<>() : new ArrayList<>(body);
	}

	public Expression getCondition()
	{
		return condition;
	}

	public List<Statement> getBody()
	{
		return Collections.unmodifiableList(body);
	}

	@Override
	public <R, A> R accept(StatementVisitor<R, A> visitor, A arg)
	{
		return visitor.visitWhile(this, arg);
	}
}
