// File: src/main/java/org/lokray/quasar/semantic/type/NullType.java
package org.lokray.quasar.semantic.type;

/**
 * The empty type. Return type of procedures and base type of untyped pointers.
 */
public class NullType implements Type
{
	public static final NullType INSTANCE = new NullType();

	private NullType()
	{
	}

	@Override
	public String getName()
	{
		return "<NULL>";
	}

	@Override
	public boolean match(Type other)
	{
		return other != null && other.isNull();
	}

	@Override
	public int getSize()
	{
		return 0;
	}

	@Override
	public boolean isNull()
	{
		return true;
	}

	@Override
	public String toString()
	{
		return getName();
	}
}
