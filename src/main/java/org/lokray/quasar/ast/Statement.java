package org.lokray.quasar.ast;

import org.antlr.v4.runtime.Token;

public abstract class Statement extends AstNode
{
	protected Statement(CompilationContext context, Token token)
	{
		super(context, token);
	}

	public abstract <R, A> R accept(StatementVisitor<R, A> visitor, A arg);
}
