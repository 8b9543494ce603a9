package org.lokray.quasar.tac;

public class TacConstant extends TacAddress
{
	private final long value;

	public TacConstant(long value)
	{
		this.value = value;
	}

	public long getValue()
	{
		return value;
	}

	@Override
	public boolean equals(Object o)
	{
		return o instanceof TacConstant other && other.value == value;
	}

	@Override
	public int hashCode()
	{
		return Long.hashCode(value);
	}

	@Override
	public String toString()
	{
		return String.valueOf(value);
	}
}
