package org.lokray.quasar.dto;

import java.util.ArrayList;
import java.util.List;

public class ScopeDTO
{
	public String name;
	public String returnType;
	public List<SymbolDTO> symbols = new ArrayList<>();
	public List<InstructionDTO> instructions = new ArrayList<>();
}
