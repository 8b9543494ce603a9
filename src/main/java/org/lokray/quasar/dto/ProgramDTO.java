package org.lokray.quasar.dto;

import java.util.ArrayList;
import java.util.List;

public class ProgramDTO
{
	public String module;
	public List<ScopeDTO> scopes = new ArrayList<>();
}
