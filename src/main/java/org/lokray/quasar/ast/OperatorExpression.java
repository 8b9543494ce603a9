package org.lokray.quasar.ast;

import org.antlr.v4.runtime.Token;
import org.lokray.quasar.tac.Operation;

public abstract class OperatorExpression extends Expression
{
	private final Operation operation;

	protected OperatorExpression(CompilationContext context, Token token, Operation operation)
	{
		super(context, token);
		this.operation = operation;
	}

	public Operation getOperation()
	{
		return operation;
	}
}
