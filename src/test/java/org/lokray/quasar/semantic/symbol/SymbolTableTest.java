package org.lokray.quasar.semantic.symbol;

import org.junit.jupiter.api.Test;
import org.lokray.quasar.semantic.type.PrimitiveType;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SymbolTableTest
{
	@Test
	void resolvesThroughEnclosingTables()
	{
		SymbolTable globals = new SymbolTable(null);
		VariableSymbol x = VariableSymbol.global("x", PrimitiveType.INT);
		globals.define(x);
		SymbolTable locals = new SymbolTable(globals);
		VariableSymbol shadow = VariableSymbol.local("x", PrimitiveType.CHAR);

		assertSame(x, locals.resolve("x").orElseThrow());
		assertTrue(locals.resolveLocally("x").isEmpty());

		locals.define(shadow);
		assertSame(shadow, locals.resolve("x").orElseThrow());
		assertTrue(locals.resolve("missing").isEmpty());
	}

	@Test
	void rejectsDuplicatesInTheSameTable()
	{
		SymbolTable table = new SymbolTable(null);
		table.define(VariableSymbol.global("x", PrimitiveType.INT));

		assertThrows(IllegalArgumentException.class, () -> table.define(VariableSymbol.global("x", PrimitiveType.CHAR)));
	}

	@Test
	void keepsDeclarationOrder()
	{
		SymbolTable table = new SymbolTable(null);
		table.define(VariableSymbol.global("c", PrimitiveType.INT));
		table.define(VariableSymbol.global("a", PrimitiveType.INT));
		table.define(new ProcedureSymbol("b", null));

		List<String> names = table.getSymbols().stream().map(Symbol::getName).collect(Collectors.toList());
		assertEquals(List.of("c", "a", "b"), names);
		assertEquals(1, table.getSymbols(SymbolKind.PROCEDURE).size());
	}

	@Test
	void procedureParametersKeepTheirPositions()
	{
		ProcedureSymbol procedure = new ProcedureSymbol("max", PrimitiveType.INT);
		ParameterSymbol first = procedure.addParameter("a", PrimitiveType.INT);
		ParameterSymbol second = procedure.addParameter("b", PrimitiveType.INT);

		assertEquals(0, first.getPosition());
		assertEquals(1, second.getPosition());
		assertSame(SymbolKind.PARAMETER, second.getKind());
		assertEquals(List.of(PrimitiveType.INT, PrimitiveType.INT), procedure.getParameterTypes());
		assertTrue(new ProcedureSymbol("run", null).getType().isNull());
	}

	@Test
	void onlyGlobalsCarryData()
	{
		VariableSymbol global = VariableSymbol.global("_str_1", PrimitiveType.CHAR);
		global.setData("hi");

		assertEquals("hi", global.getData().orElseThrow());
		assertThrows(IllegalStateException.class, () -> VariableSymbol.local("t0", PrimitiveType.INT).setData("x"));
	}

	@Test
	void runtimeProceduresAreInstalled()
	{
		SymbolTable table = new SymbolTable(null);
		RuntimeProcedures.install(table);

		ProcedureSymbol dim = (ProcedureSymbol) table.resolve(RuntimeProcedures.DIM).orElseThrow();
		assertEquals(2, dim.getParameterCount());
		assertSame(PrimitiveType.INT, dim.getType());
		assertTrue(dim.getParameter(0).getType().isPointer());

		ProcedureSymbol dofs = (ProcedureSymbol) table.resolve(RuntimeProcedures.DOFS).orElseThrow();
		assertEquals(1, dofs.getParameterCount());

		for (String name : List.of(RuntimeProcedures.READ_INT, RuntimeProcedures.WRITE_INT, RuntimeProcedures.WRITE_CHAR,
				RuntimeProcedures.WRITE_STR, RuntimeProcedures.WRITE_LN))
		{
			assertTrue(table.contains(name), name);
		}
	}
}
