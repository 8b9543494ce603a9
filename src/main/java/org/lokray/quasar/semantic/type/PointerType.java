// File: src/main/java/org/lokray/quasar/semantic/type/PointerType.java
package org.lokray.quasar.semantic.type;

import java.util.Objects;

/**
 * Pointer to a value of the base type. Arrays are passed to procedures as
 * pointers to (usually open) arrays.
 */
public class PointerType implements Type
{
	private final Type baseType;

	public PointerType(Type baseType)
	{
		this.baseType = Objects.requireNonNull(baseType, "baseType");
	}

	public Type getBaseType()
	{
		return baseType;
	}

	@Override
	public String getName()
	{
		return "ptr to " + baseType.getName();
	}

	/**
	 * Pointers match when their base types do. A pointer to the empty type is
	 * compatible with every other pointer.
	 */
	@Override
	public boolean match(Type other)
	{
		if (!(other instanceof PointerType otherPointer))
		{
			return false;
		}
		if (baseType.isNull() || otherPointer.baseType.isNull())
		{
			return true;
		}
		return baseType.match(otherPointer.baseType);
	}

	@Override
	public int getSize()
	{
		return 8;
	}

	@Override
	public boolean isScalar()
	{
		return true;
	}

	@Override
	public boolean isPointer()
	{
		return true;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (o == null || getClass() != o.getClass())
		{
			return false;
		}
		return Objects.equals(baseType, ((PointerType) o).baseType);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(baseType);
	}

	@Override
	public String toString()
	{
		return getName();
	}
}
