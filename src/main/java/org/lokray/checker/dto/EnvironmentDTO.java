package org.lokray.checker.dto;

import java.util.ArrayList;
import java.util.List;

public class EnvironmentDTO
{
	public String source;
	public int names;
	public int levels;
	public int expressions;
	public List<DeclarationDTO> declarations = new ArrayList<>();
}
