package org.lokray.checker.environment.term;

public final class MaxLevel implements Level
{
	private final int lhs;
	private final int rhs;

	public MaxLevel(int lhs, int rhs)
	{
		this.lhs = lhs;
		this.rhs = rhs;
	}

	public int getLhs()
	{
		return lhs;
	}

	public int getRhs()
	{
		return rhs;
	}
}
