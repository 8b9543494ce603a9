// File: src/main/java/org/lokray/quasar/semantic/type/ErrorType.java
package org.lokray.quasar.semantic.type;

/**
 * Type of an ill-typed expression. Matches nothing, not even itself.
 */
public class ErrorType implements Type
{
	public static final ErrorType INSTANCE = new ErrorType();

	private ErrorType()
	{
	}

	@Override
	public String getName()
	{
		return "<INVALID>";
	}

	@Override
	public boolean match(Type other)
	{
		return false;
	}

	@Override
	public int getSize()
	{
		return 0;
	}

	@Override
	public boolean isValid()
	{
		return false;
	}

	@Override
	public String toString()
	{
		return getName();
	}
}
