// File: src/main/java/org/lokray/quasar/tac/CodeBlock.java
package org.lokray.quasar.tac;

import org.lokray.quasar.ast.ScopeNode;
import org.lokray.quasar.semantic.symbol.SymbolTable;
import org.lokray.quasar.semantic.symbol.VariableSymbol;
import org.lokray.quasar.semantic.type.Type;
import org.lokray.quasar.util.Debug;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.ListIterator;
import java.util.Set;

/**
 * The instruction stream of one scope. Hands out fresh labels and temporaries
 * and collects instructions in emission order.
 */
public class CodeBlock
{
	private final ScopeNode owner;
	private final List<TacInstruction> instructions = new ArrayList<>();
	private int labelCounter = 0;
	private int temporaryCounter = 0;

	public CodeBlock(ScopeNode owner)
	{
		this.owner = owner;
	}

	public ScopeNode getOwner()
	{
		return owner;
	}

	public TacLabel createLabel()
	{
		return new TacLabel(labelCounter++);
	}

	/**
	 * Creates a fresh temporary and declares it as a local of the owning scope.
	 */
	public TacTemporary createTemporary(Type type)
	{
		SymbolTable table = owner.getSymbolTable();
		String name;
		do
		{
			name = "t" + temporaryCounter++;
		}
		while (table.contains(name));

		VariableSymbol symbol = VariableSymbol.local(name, type);
		table.define(symbol);
		return new TacTemporary(symbol);
	}

	public void addInstruction(TacInstruction instruction)
	{
		instructions.add(instruction);
	}

	public void addInstruction(Operation operation, TacAddress dest, TacAddress src1, TacAddress src2)
	{
		instructions.add(TacInstruction.of(operation, dest, src1, src2));
	}

	public void addJump(TacLabel target)
	{
		instructions.add(TacInstruction.jump(target));
	}

	public void addBranch(Operation relation, TacLabel target, TacAddress left, TacAddress right)
	{
		instructions.add(TacInstruction.branch(relation, target, left, right));
	}

	public List<TacInstruction> getInstructions()
	{
		return Collections.unmodifiableList(instructions);
	}

	/**
	 * Removes the jumps and labels that the statement lowering leaves behind.
	 * Repeats until nothing changes:
	 * <ul>
	 *     <li>an unconditional jump to a label that directly follows it (possibly
	 *     behind other labels) is removed;</li>
	 *     <li>instructions after an unconditional jump are unreachable up to the
	 *     next label and are removed;</li>
	 *     <li>labels that no jump refers to are removed.</li>
	 * </ul>
	 */
	public void cleanupControlFlow()
	{
		int before = instructions.size();
		boolean changed;
		do
		{
			changed = removeJumpsToNextLabel();
			changed |= removeUnreachableInstructions();
			changed |= removeUnusedLabels();
		}
		while (changed);
		Debug.logDebug("Control flow cleanup in '" + owner.getName() + "': " + before + " -> " + instructions.size() + " instructions.");
	}

	private boolean removeJumpsToNextLabel()
	{
		boolean changed = false;
		for (int i = 0; i < instructions.size(); i++)
		{
			TacInstruction instruction = instructions.get(i);
			if (!instruction.isUnconditionalJump())
			{
				continue;
			}
			for (int j = i + 1; j < instructions.size() && instructions.get(j).isLabel(); j++)
			{
				if (instructions.get(j) == instruction.getTarget())
				{
					instructions.remove(i);
					i--;
					changed = true;
					break;
				}
			}
		}
		return changed;
	}

	private boolean removeUnreachableInstructions()
	{
		boolean changed = false;
		boolean unreachable = false;
		ListIterator<TacInstruction> it = instructions.listIterator();
		while (it.hasNext())
		{
			TacInstruction instruction = it.next();
			if (instruction.isLabel())
			{
				unreachable = false;
			}
			else if (unreachable)
			{
				it.remove();
				changed = true;
			}
			else if (instruction.isUnconditionalJump())
			{
				unreachable = true;
			}
		}
		return changed;
	}

	private boolean removeUnusedLabels()
	{
		Set<TacLabel> referenced = new HashSet<>();
		for (TacInstruction instruction : instructions)
		{
			if (instruction.isJump())
			{
				referenced.add(instruction.getTarget());
			}
		}
		return instructions.removeIf(i -> i.isLabel() && !referenced.contains(i));
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder();
		for (TacInstruction instruction : instructions)
		{
			if (instruction.isLabel())
			{
				sb.append(instruction).append('\n');
			}
			else
			{
				sb.append("    ").append(instruction).append('\n');
			}
		}
		return sb.toString();
	}
}
