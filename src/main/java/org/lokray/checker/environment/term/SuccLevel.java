package org.lokray.checker.environment.term;

public final class SuccLevel implements Level
{
	private final int level;

	public SuccLevel(int level)
	{
		this.level = level;
	}

	public int getLevel()
	{
		return level;
	}
}
