package org.lokray.quasar.ast;

import org.antlr.v4.runtime.Token;

import java.util.Objects;

/**
 * A procedure call whose result, if any, is discarded.
 */
public class CallStatement extends Statement
{
	private final FunctionCall call;

	public CallStatement(CompilationContext context, Token token, FunctionCall call)
	{
		super(context, token);
		this.call = Objects.requireNonNull(call, "call");
	}

	public FunctionCall getCall()
	{
		return call;
	}

	@Override
	public <R, A> R accept(StatementVisitor<R, A> visitor, A arg)
	{
		return visitor.visitCall(this, arg);
	}
}
