// File: src/main/java/org/lokray/quasar/semantic/symbol/VariableSymbol.java
package org.lokray.quasar.semantic.symbol;

import org.lokray.quasar.semantic.type.Type;

import java.util.Optional;

public class VariableSymbol implements Symbol
{
	private final String name;
	private final Type type;
	private final SymbolKind kind;
	// Initial contents of a global, e.g. the characters of a string literal
	private String data;

	public VariableSymbol(String name, Type type, SymbolKind kind)
	{
		if (kind == SymbolKind.PROCEDURE)
		{
			throw new IllegalArgumentException("Use ProcedureSymbol for procedures.");
		}
		this.name = name;
		this.type = type;
		this.kind = kind;
	}

	public static VariableSymbol global(String name, Type type)
	{
		return new VariableSymbol(name, type, SymbolKind.GLOBAL);
	}

	public static VariableSymbol local(String name, Type type)
	{
		return new VariableSymbol(name, type, SymbolKind.LOCAL);
	}

	@Override
	public String getName()
	{
		return name;
	}

	@Override
	public Type getType()
	{
		return type;
	}

	@Override
	public SymbolKind getKind()
	{
		return kind;
	}

	public Optional<String> getData()
	{
		return Optional.ofNullable(data);
	}

	public void setData(String data)
	{
		if (kind != SymbolKind.GLOBAL)
		{
			throw new IllegalStateException("Only globals carry initial data: " + name);
		}
		this.data = data;
	}

	@Override
	public String toString()
	{
		return "[@" + name + " " + type + "]";
	}
}
