// File: src/main/java/org/lokray/quasar/tac/Operation.java
package org.lokray.quasar.tac;

/**
 * Operations shared by expression nodes and three-address code instructions.
 */
public enum Operation
{
	// binary operators
	ADD("add"),
	SUB("sub"),
	MUL("mul"),
	DIV("div"),
	AND("and"),
	OR("or"),

	// relational operators; also used as conditional jumps
	EQUAL("="),
	NOT_EQUAL("#"),
	LESS_THAN("<"),
	LESS_EQUAL("<="),
	BIGGER_THAN(">"),
	BIGGER_EQUAL(">="),

	// unary operators
	NEG("neg"),
	POS("pos"),
	NOT("not"),

	// special operators
	ADDRESS("&()"),
	DEREF("*()"),
	CAST("cast"),

	// memory and control flow
	ASSIGN("assign"),
	GOTO("goto"),
	PARAM("param"),
	CALL("call"),
	RETURN("return"),
	LABEL("label");

	private final String symbol;

	Operation(String symbol)
	{
		this.symbol = symbol;
	}

	public String getSymbol()
	{
		return symbol;
	}

	public boolean isArithmetic()
	{
		return this == ADD || this == SUB || this == MUL || this == DIV;
	}

	public boolean isLogical()
	{
		return this == AND || this == OR;
	}

	public boolean isEquality()
	{
		return this == EQUAL || this == NOT_EQUAL;
	}

	public boolean isOrdering()
	{
		return this == LESS_THAN || this == LESS_EQUAL || this == BIGGER_THAN || this == BIGGER_EQUAL;
	}

	public boolean isRelational()
	{
		return isEquality() || isOrdering();
	}

	public boolean isBinary()
	{
		return isArithmetic() || isLogical() || isRelational();
	}

	public boolean isUnary()
	{
		return this == NEG || this == POS || this == NOT;
	}

	public boolean isSpecial()
	{
		return this == ADDRESS || this == DEREF || this == CAST;
	}

	@Override
	public String toString()
	{
		return symbol;
	}
}
