// File: src/main/java/org/lokray/quasar/ast/StringConstant.java
package org.lokray.quasar.ast;

import org.antlr.v4.runtime.Token;
import org.lokray.quasar.semantic.symbol.VariableSymbol;
import org.lokray.quasar.semantic.type.ArrayType;
import org.lokray.quasar.semantic.type.PrimitiveType;
import org.lokray.quasar.semantic.type.Type;
import org.lokray.quasar.semantic.type.TypeManager;

/**
 * A string literal. Constructing one declares a fresh global {@code _str_<n>}
 * in the given scope that holds the characters plus the terminating zero.
 */
public class StringConstant extends Expression
{
	private final String value;
	private final ArrayType type;
	private final VariableSymbol symbol;

	/**
	 * @param value the literal as written in the source, escapes not yet resolved.
	 */
	public StringConstant(CompilationContext context, Token token, String value, ScopeNode scope)
	{
		super(context, token);
		this.value = value;
		this.type = TypeManager.getArray(unescape(value).length() + 1, PrimitiveType.CHAR);
		this.symbol = VariableSymbol.global(context.nextStringConstantName(), type);
		symbol.setData(value);
		scope.getSymbolTable().define(symbol);
	}

	public String getValue()
	{
		return value;
	}

	public VariableSymbol getSymbol()
	{
		return symbol;
	}

	@Override
	public Type getType()
	{
		return type;
	}

	@Override
	public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg)
	{
		return visitor.visitStringConstant(this, arg);
	}

	static String unescape(String text)
	{
		StringBuilder sb = new StringBuilder(text.length());
		for (int i = 0; i < text.length(); i++)
		{
			char c = text.charAt(i);
			if (c != '\\' || i + 1 == text.length())
			{
				sb.append(c);
				continue;
			}
			char next = text.charAt(++i);
			switch (next)
			{
				case 'n' -> sb.append('\n');
				case 't' -> sb.append('\t');
				case '0' -> sb.append('\0');
				default -> sb.append(next);
			}
		}
		return sb.toString();
	}
}
