// File: src/main/java/org/lokray/quasar/semantic/symbol/RuntimeProcedures.java
package org.lokray.quasar.semantic.symbol;

import org.lokray.quasar.semantic.type.ArrayType;
import org.lokray.quasar.semantic.type.PrimitiveType;
import org.lokray.quasar.semantic.type.Type;
import org.lokray.quasar.semantic.type.TypeManager;

/**
 * Procedures provided by the runtime library and visible in every module.
 */
public final class RuntimeProcedures
{
	/**
	 * {@code DIM(array, n)} returns the number of elements in the n-th dimension
	 * of the array (1-based).
	 */
	public static final String DIM = "DIM";

	/**
	 * {@code DOFS(array)} returns the displacement of the first element from
	 * the start of the array, i.e. the size of the array header.
	 */
	public static final String DOFS = "DOFS";

	public static final String READ_INT = "ReadInt";
	public static final String WRITE_INT = "WriteInt";
	public static final String WRITE_CHAR = "WriteChar";
	public static final String WRITE_STR = "WriteStr";
	public static final String WRITE_LN = "WriteLn";

	private RuntimeProcedures()
	{
	}

	public static void install(SymbolTable table)
	{
		Type anyPointer = TypeManager.getPointer(TypeManager.getNull());

		ProcedureSymbol dim = new ProcedureSymbol(DIM, PrimitiveType.INT);
		dim.addParameter("array", anyPointer);
		dim.addParameter("dim", PrimitiveType.INT);
		table.define(dim);

		ProcedureSymbol dofs = new ProcedureSymbol(DOFS, PrimitiveType.INT);
		dofs.addParameter("array", anyPointer);
		table.define(dofs);

		table.define(new ProcedureSymbol(READ_INT, PrimitiveType.INT));

		ProcedureSymbol writeInt = new ProcedureSymbol(WRITE_INT, TypeManager.getNull());
		writeInt.addParameter("i", PrimitiveType.INT);
		table.define(writeInt);

		ProcedureSymbol writeChar = new ProcedureSymbol(WRITE_CHAR, TypeManager.getNull());
		writeChar.addParameter("c", PrimitiveType.CHAR);
		table.define(writeChar);

		ProcedureSymbol writeStr = new ProcedureSymbol(WRITE_STR, TypeManager.getNull());
		writeStr.addParameter("str", TypeManager.getPointer(TypeManager.getArray(ArrayType.OPEN, PrimitiveType.CHAR)));
		table.define(writeStr);

		table.define(new ProcedureSymbol(WRITE_LN, TypeManager.getNull()));
	}
}
