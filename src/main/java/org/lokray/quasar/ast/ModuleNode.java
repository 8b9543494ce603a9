package org.lokray.quasar.ast;

import org.antlr.v4.runtime.Token;
import org.lokray.quasar.semantic.symbol.RuntimeProcedures;
import org.lokray.quasar.semantic.symbol.SymbolTable;
import org.lokray.quasar.semantic.symbol.VariableSymbol;
import org.lokray.quasar.semantic.type.Type;

/**
 * The outermost scope. Its symbol table holds the globals and the runtime
 * library procedures.
 */
public class ModuleNode extends ScopeNode
{
	public ModuleNode(CompilationContext context, Token token, String name)
	{
		super(context, token, name, null, new SymbolTable(null));
		RuntimeProcedures.install(getSymbolTable());
	}

	@Override
	public VariableSymbol createVariable(String name, Type type)
	{
		return VariableSymbol.global(name, type);
	}
}
