package org.lokray.quasar.tac;

/**
 * An operand of a three-address code instruction.
 */
public abstract class TacAddress
{
	@Override
	public abstract String toString();
}
