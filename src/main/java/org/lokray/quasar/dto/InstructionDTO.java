package org.lokray.quasar.dto;

public class InstructionDTO
{
	public String op;
	public String dest;
	public String src1;
	public String src2;
	public String label;
	public String text;
}
