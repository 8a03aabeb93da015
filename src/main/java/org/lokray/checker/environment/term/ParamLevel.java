package org.lokray.checker.environment.term;

/**
 * A universe level variable, referring to its name.
 */
public final class ParamLevel implements Level
{
	private final int name;

	public ParamLevel(int name)
	{
		this.name = name;
	}

	public int getName()
	{
		return name;
	}
}
