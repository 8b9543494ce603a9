package org.lokray.quasar.ast;

import org.antlr.v4.runtime.Token;
import org.lokray.quasar.semantic.symbol.Symbol;
import org.lokray.quasar.semantic.type.ErrorType;
import org.lokray.quasar.semantic.type.Type;

import java.util.Objects;

/**
 * A reference to a declared variable, parameter or constant.
 */
public class Designator extends Expression
{
	private final Symbol symbol;

	public Designator(CompilationContext context, Token token, Symbol symbol)
	{
		super(context, token);
		this.symbol = Objects.requireNonNull(symbol, "symbol");
	}

	public Symbol getSymbol()
	{
		return symbol;
	}

	@Override
	public Type getType()
	{
		return symbol.getType() != null ? symbol.getType() : ErrorType.INSTANCE;
	}

	@Override
	public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg)
	{
		return visitor.visitDesignator(this, arg);
	}
}
