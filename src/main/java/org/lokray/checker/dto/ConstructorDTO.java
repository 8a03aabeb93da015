package org.lokray.checker.dto;

public class ConstructorDTO
{
	public String name;
	public String type;
}
