package org.lokray.checker.dto;

import java.util.ArrayList;
import java.util.List;

public class DeclarationDTO
{
	public String kind; // "definition" or "inductive"
	public String name;
	public List<String> levelParams = new ArrayList<>();
	public String type;
	public String value; // definitions only
	public Integer numParams; // inductives only
	public List<ConstructorDTO> constructors; // inductives only
}
