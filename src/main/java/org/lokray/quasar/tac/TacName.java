package org.lokray.quasar.tac;

import org.lokray.quasar.semantic.symbol.Symbol;

import java.util.Objects;

/**
 * A named storage location: a variable, a parameter, a procedure or a
 * temporary.
 */
public class TacName extends TacAddress
{
	private final Symbol symbol;

	public TacName(Symbol symbol)
	{
		this.symbol = Objects.requireNonNull(symbol, "symbol");
	}

	public Symbol getSymbol()
	{
		return symbol;
	}

	@Override
	public String toString()
	{
		return symbol.getName();
	}
}
