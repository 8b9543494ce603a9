package org.lokray.quasar.ast;

import org.antlr.v4.runtime.Token;

/**
 * Leaves the innermost enclosing loop. The parser only accepts breaks inside
 * loops.
 */
public class BreakStatement extends Statement
{
	public BreakStatement(CompilationContext context, Token token)
	{
		super(context, token);
	}

	@Override
	public <R, A> R accept(StatementVisitor<R, A> visitor, A arg)
	{
		return visitor.visitBreak(this, arg);
	}
}
