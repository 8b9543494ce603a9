package org.lokray.quasar.tac;

/**
 * A jump target. Labels live in the instruction stream as pseudo-instructions.
 */
public class TacLabel extends TacInstruction
{
	private final int id;

	public TacLabel(int id)
	{
		super(Operation.LABEL, null, null, null, null);
		this.id = id;
	}

	public int getId()
	{
		return id;
	}

	public String getName()
	{
		return "L" + id;
	}

	@Override
	public boolean isLabel()
	{
		return true;
	}

	@Override
	public String toString()
	{
		return getName() + ":";
	}
}
