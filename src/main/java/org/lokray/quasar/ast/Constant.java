package org.lokray.quasar.ast;

import org.antlr.v4.runtime.Token;
import org.lokray.quasar.semantic.type.Type;

import java.util.Objects;

/**
 * An integer, character or boolean literal. Characters hold their code and
 * booleans 0 or 1.
 */
public class Constant extends Expression
{
	private final Type type;
	private final long value;

	public Constant(CompilationContext context, Token token, Type type, long value)
	{
		super(context, token);
		this.type = Objects.requireNonNull(type, "type");
		this.value = value;
	}

	public long getValue()
	{
		return value;
	}

	public String getValueString()
	{
		if (type.isBoolean())
		{
			return value == 0 ? "false" : "true";
		}
		return String.valueOf(value);
	}

	@Override
	public Type getType()
	{
		return type;
	}

	@Override
	public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg)
	{
		return visitor.visitConstant(this, arg);
	}
}
