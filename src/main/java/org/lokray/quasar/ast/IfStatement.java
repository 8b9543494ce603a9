package org.lokray.quasar.ast;

import org.antlr.v4.runtime.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class IfStatement extends Statement
{
	private final Expression condition;
	private final List<Statement> ifBody;
	private final List<Statement> elseBody;

	public IfStatement(CompilationContext context, Token token, Expression condition, List<Statement> ifBody, List<Statement> elseBody)
	{
		super(context, token);
		this.condition = Objects.requireNonNull(condition, "condition");
		this.ifBody = ifBody == null ? new ArrayList<>() : new ArrayList<>(ifBody);
		this.elseBody = elseBody == null ? new ArrayList<>() : new ArrayList<>(elseBody);
	}

	public Expression getCondition()
	{
		return condition;
	}

	public List<Statement> getIfBody()
	{
		return Collections.unmodifiableList(ifBody);
	}

	public List<Statement> getElseBody()
	{
		return Collections.unmodifiableList(elseBody);
	}

	@Override
	public <R, A> R accept(StatementVisitor<R, A> visitor, A arg)
	{
		return visitor.visitIf(this, arg);
	}
}
