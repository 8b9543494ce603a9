// File: src/main/java/org/lokray/quasar/semantic/type/ArrayType.java
package org.lokray.quasar.semantic.type;

import java.util.Objects;

/**
 * A (possibly multi-dimensional) array type. A multi-dimensional array is an
 * array whose inner type is again an array.
 * <p>
 * Arrays received by reference have an {@link #OPEN} element count; their
 * dimensions are only known at runtime and must be queried through the
 * runtime helpers. At runtime every array starts with a header holding the
 * number of dimensions followed by the size of each dimension, which is why
 * {@link #getSize()} exceeds {@link #getDataSize()}.
 */
public class ArrayType implements Type
{
	public static final int OPEN = -1;

	private final int elementCount;
	private final Type innerType;

	public ArrayType(int elementCount, Type innerType)
	{
		if (innerType == null || innerType.isNull())
		{
			throw new IllegalArgumentException("Arrays of the empty type are not allowed.");
		}
		if (elementCount < 0 && elementCount != OPEN)
		{
			throw new IllegalArgumentException("Invalid array element count: " + elementCount);
		}
		this.elementCount = elementCount;
		this.innerType = innerType;
	}

	public int getElementCount()
	{
		return elementCount;
	}

	public boolean isOpen()
	{
		return elementCount == OPEN;
	}

	public Type getInnerType()
	{
		return innerType;
	}

	/**
	 * @return the innermost, non-array element type.
	 */
	public Type getBaseType()
	{
		Type t = innerType;
		while (t instanceof ArrayType inner)
		{
			t = inner.getInnerType();
		}
		return t;
	}

	public int getNDim()
	{
		int n = 1;
		Type t = innerType;
		while (t instanceof ArrayType inner)
		{
			n++;
			t = inner.getInnerType();
		}
		return n;
	}

	@Override
	public String getName()
	{
		return "array " + (isOpen() ? "" : String.valueOf(elementCount)) + " of " + innerType.getName();
	}

	@Override
	public boolean match(Type other)
	{
		if (!(other instanceof ArrayType otherArray))
		{
			return false;
		}
		if (!isOpen() && !otherArray.isOpen() && elementCount != otherArray.elementCount)
		{
			return false;
		}
		return innerType.match(otherArray.innerType);
	}

	@Override
	public int getSize()
	{
		// dimension count plus one size entry per dimension
		return 4 + 4 * getNDim() + getDataSize();
	}

	@Override
	public int getDataSize()
	{
		if (isOpen())
		{
			return 0;
		}
		return elementCount * innerType.getDataSize();
	}

	@Override
	public boolean isArray()
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
		ArrayType arrayType = (ArrayType) o;
		return elementCount == arrayType.elementCount && Objects.equals(innerType, arrayType.innerType);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(elementCount, innerType);
	}

	@Override
	public String toString()
	{
		return getName();
	}
}
