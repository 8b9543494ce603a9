// File: src/main/java/org/lokray/quasar/util/TacDTOConverter.java
package org.lokray.quasar.util;

import org.lokray.quasar.ast.ScopeNode;
import org.lokray.quasar.dto.InstructionDTO;
import org.lokray.quasar.dto.ProgramDTO;
import org.lokray.quasar.dto.ScopeDTO;
import org.lokray.quasar.dto.SymbolDTO;
import org.lokray.quasar.semantic.symbol.SymbolKind;
import org.lokray.quasar.semantic.symbol.VariableSymbol;
import org.lokray.quasar.tac.CodeBlock;
import org.lokray.quasar.tac.TacAddress;
import org.lokray.quasar.tac.TacInstruction;
import org.lokray.quasar.tac.TacLabel;
import org.lokray.quasar.tac.TacProgram;

public class TacDTOConverter
{
	public static ProgramDTO toProgram(TacProgram program)
	{
		ProgramDTO dto = new ProgramDTO();
		dto.module = program.getModule().getName();
		program.getCodeBlocks().forEach((scope, block) -> dto.scopes.add(scopeToDTO(scope, block)));
		return dto;
	}

	private static ScopeDTO scopeToDTO(ScopeNode scope, CodeBlock block)
	{
		ScopeDTO dto = new ScopeDTO();
		dto.name = scope.getName();
		dto.returnType = scope.getType().getName();

		// procedures are listed as scopes of their own
		scope.getSymbolTable().forEachSymbol((name, sym) ->
		{
			if (sym.getKind() == SymbolKind.PROCEDURE)
			{
				return;
			}
			SymbolDTO sd = new SymbolDTO();
			sd.name = name;
			sd.kind = sym.getKind().name();
			sd.type = sym.getType().getName();
			if (sym instanceof VariableSymbol vs)
			{
				sd.data = vs.getData().orElse(null);
			}
			dto.symbols.add(sd);
		});

		for (TacInstruction instruction : block.getInstructions())
		{
			dto.instructions.add(instructionToDTO(instruction));
		}
		return dto;
	}

	private static InstructionDTO instructionToDTO(TacInstruction instruction)
	{
		InstructionDTO dto = new InstructionDTO();
		dto.op = instruction.getOperation().name();
		dto.dest = operand(instruction.getDest());
		dto.src1 = operand(instruction.getSrc1());
		dto.src2 = operand(instruction.getSrc2());
		if (instruction instanceof TacLabel label)
		{
			dto.label = label.getName();
		}
		else if (instruction.isJump())
		{
			dto.label = instruction.getTarget().getName();
		}
		dto.text = instruction.toString();
		return dto;
	}

	private static String operand(TacAddress address)
	{
		return address == null ? null : address.toString();
	}
}
