// File: src/main/java/org/lokray/quasar/ast/ArrayDesignator.java
package org.lokray.quasar.ast;

import org.antlr.v4.runtime.Token;
import org.lokray.quasar.semantic.symbol.Symbol;
import org.lokray.quasar.semantic.type.ArrayType;
import org.lokray.quasar.semantic.type.ErrorType;
import org.lokray.quasar.semantic.type.PointerType;
import org.lokray.quasar.semantic.type.Type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An indexed array element, {@code a[i][j]}. The symbol is an array or a
 * pointer to an array (an array parameter).
 * <p>
 * Indices are appended while parsing; {@link #indicesComplete()} seals the
 * list, after which no further index may be added.
 */
public class ArrayDesignator extends Designator
{
	private final List<Expression> indices = new ArrayList<>();
	private boolean complete = false;

	public ArrayDesignator(CompilationContext context, Token token, Symbol symbol)
	{
		super(context, token, symbol);
	}

	public void addIndex(Expression index)
	{
		if (complete)
		{
			throw new IllegalStateException("Indices of '" + getSymbol().getName() + "' are already complete.");
		}
		indices.add(Objects.requireNonNull(index, "index"));
	}

	public void indicesComplete()
	{
		if (complete)
		{
			throw new IllegalStateException("Indices of '" + getSymbol().getName() + "' were already marked complete.");
		}
		complete = true;
	}

	public boolean isComplete()
	{
		return complete;
	}

	public List<Expression> getIndices()
	{
		return Collections.unmodifiableList(indices);
	}

	public int getIndexCount()
	{
		return indices.size();
	}

	/**
	 * @return the declared array type, looking through one pointer, or null if
	 * the symbol is neither an array nor a pointer to one.
	 */
	public ArrayType getArrayType()
	{
		Type declared = getSymbol().getType();
		if (declared instanceof PointerType pointer)
		{
			declared = pointer.getBaseType();
		}
		return declared instanceof ArrayType array ? array : null;
	}

	/**
	 * Each index strips one dimension. Too few indices leave an array type, too
	 * many yield {@link ErrorType}.
	 */
	@Override
	public Type getType()
	{
		Type type = getArrayType();
		if (type == null)
		{
			return ErrorType.INSTANCE;
		}
		for (int i = 0; i < indices.size(); i++)
		{
			if (!(type instanceof ArrayType array))
			{
				return ErrorType.INSTANCE;
			}
			type = array.getInnerType();
		}
		return type;
	}

	@Override
	public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg)
	{
		return visitor.visitArrayDesignator(this, arg);
	}
}
