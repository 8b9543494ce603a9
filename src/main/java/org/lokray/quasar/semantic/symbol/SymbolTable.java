// File: src/main/java/org/lokray/quasar/semantic/symbol/SymbolTable.java
package org.lokray.quasar.semantic.symbol;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.stream.Collectors;

/**
 * Symbols declared in one lexical scope. Lookups that miss locally continue in
 * the enclosing table.
 */
public class SymbolTable
{
	private final SymbolTable enclosingTable;
	private final Map<String, Symbol> symbols = new LinkedHashMap<>();

	public SymbolTable(SymbolTable enclosingTable)
	{
		this.enclosingTable = enclosingTable;
	}

	/**
	 * @throws IllegalArgumentException if a symbol of the same name already
	 *                                  exists in this table.
	 */
	public void define(Symbol sym)
	{
		if (symbols.containsKey(sym.getName()))
		{
			throw new IllegalArgumentException("Duplicate symbol '" + sym.getName() + "'.");
		}
		symbols.put(sym.getName(), sym);
	}

	public Optional<Symbol> resolve(String name)
	{
		Optional<Symbol> local = resolveLocally(name);
		if (local.isPresent())
		{
			return local;
		}
		if (enclosingTable != null)
		{
			return enclosingTable.resolve(name);
		}
		return Optional.empty();
	}

	public Optional<Symbol> resolveLocally(String name)
	{
		return Optional.ofNullable(symbols.get(name));
	}

	public boolean contains(String name)
	{
		return symbols.containsKey(name);
	}

	public Collection<Symbol> getSymbols()
	{
		return Collections.unmodifiableCollection(symbols.values());
	}

	public Collection<Symbol> getSymbols(SymbolKind kind)
	{
		return symbols.values().stream()
				.filter(s -> s.getKind() == kind)
				.collect(Collectors.toCollection(ArrayList::new));
	}

	public void forEachSymbol(BiConsumer<String, Symbol> visitor)
	{
		symbols.forEach(visitor);
	}

	@Override
	public String toString()
	{
		return symbols.values().stream().map(Object::toString).collect(Collectors.joining("\n"));
	}
}
