package org.lokray.quasar.tac;

import org.lokray.quasar.semantic.symbol.VariableSymbol;

public class TacTemporary extends TacName
{
	public TacTemporary(VariableSymbol symbol)
	{
		super(symbol);
	}
}
