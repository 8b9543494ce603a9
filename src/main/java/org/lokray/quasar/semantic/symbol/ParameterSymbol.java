// File: src/main/java/org/lokray/quasar/semantic/symbol/ParameterSymbol.java
package org.lokray.quasar.semantic.symbol;

import org.lokray.quasar.semantic.type.Type;

public class ParameterSymbol extends VariableSymbol
{
	private final int position;

	public ParameterSymbol(String name, Type type, int position)
	{
		super(name, type, SymbolKind.PARAMETER);
		this.position = position;
	}

	public int getPosition()
	{
		return position;
	}

	@Override
	public String toString()
	{
		return "[%" + getName() + " " + getType() + " #" + position + "]";
	}
}
