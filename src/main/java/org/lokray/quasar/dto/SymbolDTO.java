package org.lokray.quasar.dto;

public class SymbolDTO
{
	public String name;
	public String kind;
	public String type;
	public String data;
}
