package org.lokray.quasar.semantic.symbol;

public enum SymbolKind
{
	GLOBAL,
	LOCAL,
	PARAMETER,
	PROCEDURE
}
