// File: src/main/java/org/lokray/quasar/ast/ProcedureNode.java
package org.lokray.quasar.ast;

import org.antlr.v4.runtime.Token;
import org.lokray.quasar.semantic.symbol.ParameterSymbol;
import org.lokray.quasar.semantic.symbol.ProcedureSymbol;
import org.lokray.quasar.semantic.symbol.SymbolTable;
import org.lokray.quasar.semantic.symbol.VariableSymbol;
import org.lokray.quasar.semantic.type.Type;

import java.util.Objects;

/**
 * A procedure or function nested in a module (or another procedure). Its
 * symbol table is enclosed by the parent's, and it registers itself with the
 * parent on construction.
 */
public class ProcedureNode extends ScopeNode
{
	private final ProcedureSymbol symbol;

	public ProcedureNode(CompilationContext context, Token token, ScopeNode parent, ProcedureSymbol symbol)
	{
		super(context, token, Objects.requireNonNull(symbol, "symbol").getName(),
				Objects.requireNonNull(parent, "A procedure needs a parent scope."),
				new SymbolTable(parent.getSymbolTable()));
		this.symbol = symbol;

		if (!parent.getSymbolTable().contains(symbol.getName()))
		{
			parent.getSymbolTable().define(symbol);
		}
		for (ParameterSymbol param : symbol.getParameters())
		{
			getSymbolTable().define(param);
		}
	}

	public ProcedureSymbol getSymbol()
	{
		return symbol;
	}

	/**
	 * @return the declared return type.
	 */
	@Override
	public Type getType()
	{
		return symbol.getType();
	}

	@Override
	public VariableSymbol createVariable(String name, Type type)
	{
		return VariableSymbol.local(name, type);
	}
}
