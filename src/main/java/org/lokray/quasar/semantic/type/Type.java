// File: src/main/java/org/lokray/quasar/semantic/type/Type.java
package org.lokray.quasar.semantic.type;

/**
 * A data type of the Quasar language.
 * <p>
 * Two types are compatible when {@link #match(Type)} holds; this is the only
 * equality the type checker relies on.
 */
public interface Type
{
	String getName();

	boolean match(Type other);

	/**
	 * @return the storage size in bytes, including any runtime metadata.
	 */
	int getSize();

	/**
	 * @return the size in bytes of the payload, excluding runtime metadata.
	 */
	default int getDataSize()
	{
		return getSize();
	}

	default boolean isScalar()
	{
		return false;
	}

	default boolean isInteger()
	{
		return false;
	}

	default boolean isBoolean()
	{
		return false;
	}

	default boolean isArray()
	{
		return false;
	}

	default boolean isPointer()
	{
		return false;
	}

	default boolean isNull()
	{
		return false;
	}

	default boolean isValid()
	{
		return true;
	}
}
