// File: src/main/java/org/lokray/quasar/semantic/symbol/Symbol.java
package org.lokray.quasar.semantic.symbol;

import org.lokray.quasar.semantic.type.Type;

public interface Symbol
{
	String getName();

	Type getType();

	SymbolKind getKind();
}
