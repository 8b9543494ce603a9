// File: src/main/java/org/lokray/quasar/tac/TacReference.java
package org.lokray.quasar.tac;

import org.lokray.quasar.semantic.symbol.Symbol;
import org.lokray.quasar.semantic.type.Type;

/**
 * Indirect access through a computed address. The address is held by the
 * symbol of this name; {@link #getTarget()} is the variable whose storage the
 * address points into, {@link #getElementType()} the type of the addressed
 * value.
 */
public class TacReference extends TacName
{
	private final Symbol target;
	private final Type elementType;

	public TacReference(Symbol address, Symbol target, Type elementType)
	{
		super(address);
		this.target = target;
		this.elementType = elementType;
	}

	public Symbol getTarget()
	{
		return target;
	}

	public Type getElementType()
	{
		return elementType;
	}

	@Override
	public String toString()
	{
		return "@" + getSymbol().getName();
	}
}
