// File: src/main/java/org/lokray/quasar/tac/TacInstruction.java
package org.lokray.quasar.tac;

import java.util.Objects;

/**
 * A single three-address code instruction: an operation, an optional
 * destination and up to two source operands. Jumps carry their target label
 * instead of a destination operand.
 */
public class TacInstruction
{
	private final Operation operation;
	private final TacAddress dest;
	private final TacLabel target;
	private final TacAddress src1;
	private final TacAddress src2;

	protected TacInstruction(Operation operation, TacAddress dest, TacLabel target, TacAddress src1, TacAddress src2)
	{
		this.operation = Objects.requireNonNull(operation, "operation");
		this.dest = dest;
		this.target = target;
		this.src1 = src1;
		this.src2 = src2;
	}

	public static TacInstruction of(Operation operation, TacAddress dest, TacAddress src1, TacAddress src2)
	{
		if (operation == Operation.GOTO || operation == Operation.LABEL)
		{
			throw new IllegalArgumentException("Use jump() or a TacLabel for " + operation);
		}
		return new TacInstruction(operation, dest, null, src1, src2);
	}

	public static TacInstruction of(Operation operation, TacAddress dest, TacAddress src1)
	{
		return of(operation, dest, src1, null);
	}

	public static TacInstruction jump(TacLabel target)
	{
		return new TacInstruction(Operation.GOTO, null, Objects.requireNonNull(target, "target"), null, null);
	}

	public static TacInstruction branch(Operation relation, TacLabel target, TacAddress left, TacAddress right)
	{
		if (!relation.isRelational())
		{
			throw new IllegalArgumentException("Conditional jumps need a relational operation, got " + relation);
		}
		return new TacInstruction(relation, null, Objects.requireNonNull(target, "target"), left, right);
	}

	public Operation getOperation()
	{
		return operation;
	}

	public TacAddress getDest()
	{
		return dest;
	}

	public TacLabel getTarget()
	{
		return target;
	}

	public TacAddress getSrc1()
	{
		return src1;
	}

	public TacAddress getSrc2()
	{
		return src2;
	}

	public boolean isLabel()
	{
		return false;
	}

	public boolean isJump()
	{
		return target != null;
	}

	public boolean isUnconditionalJump()
	{
		return operation == Operation.GOTO;
	}

	public boolean isConditionalJump()
	{
		return target != null && operation.isRelational();
	}

	@Override
	public String toString()
	{
		switch (operation)
		{
			case GOTO:
				return "goto " + target.getName();
			case ASSIGN:
				return dest + " := " + src1;
			case PARAM:
				return "param " + dest + " <- " + src1;
			case CALL:
				return dest == null ? "call " + src1 : dest + " := call " + src1;
			case RETURN:
				return src1 == null ? "return" : "return " + src1;
			default:
				break;
		}

		if (isConditionalJump())
		{
			return "if " + src1 + " " + operation + " " + src2 + " goto " + target.getName();
		}
		if (src2 != null)
		{
			return dest + " := " + src1 + " " + operation + " " + src2;
		}
		return dest + " := " + operation + " " + src1;
	}
}
