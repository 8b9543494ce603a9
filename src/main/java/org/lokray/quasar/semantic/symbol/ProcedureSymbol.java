// File: src/main/java/org/lokray/quasar/semantic/symbol/ProcedureSymbol.java
package org.lokray.quasar.semantic.symbol;

import org.lokray.quasar.semantic.type.NullType;
import org.lokray.quasar.semantic.type.Type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A procedure or function. The symbol's type is the return type; procedures
 * without a result return the {@link NullType}.
 */
public class ProcedureSymbol implements Symbol
{
	private final String name;
	private final Type returnType;
	private final List<ParameterSymbol> parameters = new ArrayList<>();

	public ProcedureSymbol(String name, Type returnType)
	{
		this.name = name;
		this.returnType = returnType == null ? NullType.INSTANCE : returnType;
	}

	/**
	 * Appends a parameter. Parameters are numbered in declaration order.
	 */
	public ParameterSymbol addParameter(String paramName, Type type)
	{
		ParameterSymbol param = new ParameterSymbol(paramName, type, parameters.size());
		parameters.add(param);
		return param;
	}

	public List<ParameterSymbol> getParameters()
	{
		return Collections.unmodifiableList(parameters);
	}

	public int getParameterCount()
	{
		return parameters.size();
	}

	public ParameterSymbol getParameter(int index)
	{
		return parameters.get(index);
	}

	public List<Type> getParameterTypes()
	{
		return parameters.stream().map(ParameterSymbol::getType).collect(Collectors.toList());
	}

	@Override
	public String getName()
	{
		return name;
	}

	@Override
	public Type getType()
	{
		return returnType;
	}

	@Override
	public SymbolKind getKind()
	{
		return SymbolKind.PROCEDURE;
	}

	@Override
	public String toString()
	{
		String params = getParameterTypes().stream().map(Type::getName).collect(Collectors.joining(", "));
		return "[*" + name + "(" + params + ") --> " + returnType + "]";
	}
}
