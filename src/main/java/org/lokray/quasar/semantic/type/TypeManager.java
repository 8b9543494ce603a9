// File: src/main/java/org/lokray/quasar/semantic/type/TypeManager.java
package org.lokray.quasar.semantic.type;

import java.util.HashMap;
import java.util.Map;

/**
 * Hands out canonical instances of the built-in types and interns the
 * composite ones, so that structurally equal array and pointer types are the
 * same object.
 */
public final class TypeManager
{
	private static final Map<ArrayType, ArrayType> ARRAYS = new HashMap<>();
	private static final Map<PointerType, PointerType> POINTERS = new HashMap<>();

	private TypeManager()
	{
	}

	public static NullType getNull()
	{
		return NullType.INSTANCE;
	}

	public static ArrayType getArray(int elementCount, Type innerType)
	{
		return ARRAYS.computeIfAbsent(new ArrayType(elementCount, innerType), a -> a);
	}

	/**
	 * Builds a multi-dimensional array, outermost dimension first.
	 */
	public static ArrayType getArray(Type baseType, int... dimensions)
	{
		if (dimensions.length == 0)
		{
			throw new IllegalArgumentException("At least one dimension is required.");
		}
		Type t = baseType;
		for (int i = dimensions.length - 1; i >= 0; i--)
		{
			t = getArray(dimensions[i], t);
		}
		return (ArrayType) t;
	}

	public static PointerType getPointer(Type baseType)
	{
		return POINTERS.computeIfAbsent(new PointerType(baseType), p -> p);
	}
}
