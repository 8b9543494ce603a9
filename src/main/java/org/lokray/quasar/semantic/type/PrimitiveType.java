// File: src/main/java/org/lokray/quasar/semantic/type/PrimitiveType.java
package org.lokray.quasar.semantic.type;

import java.math.BigInteger;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

public class PrimitiveType implements Type
{
	// --- Canonical Type Instances ---
	public static final PrimitiveType BOOLEAN = new PrimitiveType("boolean", 1);
	public static final PrimitiveType CHAR = new PrimitiveType("char", 1);
	public static final PrimitiveType INT = new PrimitiveType("integer", 4);

	public static final BigInteger MIN_CHAR = BigInteger.ZERO;
	public static final BigInteger MAX_CHAR = BigInteger.valueOf(255);
	public static final BigInteger MIN_INT = BigInteger.valueOf(Integer.MIN_VALUE);
	public static final BigInteger MAX_INT = BigInteger.valueOf(Integer.MAX_VALUE);

	private static final Map<String, PrimitiveType> KEYWORD_TO_TYPE_MAP;

	static
	{
		Map<String, PrimitiveType> map = new HashMap<>();
		map.put("boolean", BOOLEAN);
		map.put("char", CHAR);
		map.put("integer", INT);
		KEYWORD_TO_TYPE_MAP = Collections.unmodifiableMap(map);
	}

	public static Optional<PrimitiveType> fromKeyword(String keyword)
	{
		return Optional.ofNullable(KEYWORD_TO_TYPE_MAP.get(keyword));
	}

	private final String name;
	private final int size;

	private PrimitiveType(String name, int size)
	{
		this.name = name;
		this.size = size;
	}

	@Override
	public String getName()
	{
		return name;
	}

	@Override
	public boolean match(Type other)
	{
		return this == other;
	}

	@Override
	public int getSize()
	{
		return size;
	}

	@Override
	public boolean isScalar()
	{
		return true;
	}

	@Override
	public boolean isInteger()
	{
		return this == INT;
	}

	@Override
	public boolean isBoolean()
	{
		return this == BOOLEAN;
	}

	public Optional<BigInteger> getMinValue()
	{
		if (this == INT)
		{
			return Optional.of(MIN_INT);
		}
		if (this == CHAR)
		{
			return Optional.of(MIN_CHAR);
		}
		if (this == BOOLEAN)
		{
			return Optional.of(BigInteger.ZERO);
		}
		return Optional.empty();
	}

	public Optional<BigInteger> getMaxValue()
	{
		if (this == INT)
		{
			return Optional.of(MAX_INT);
		}
		if (this == CHAR)
		{
			return Optional.of(MAX_CHAR);
		}
		if (this == BOOLEAN)
		{
			return Optional.of(BigInteger.ONE);
		}
		return Optional.empty();
	}

	@Override
	public String toString()
	{
		return name;
	}
}
