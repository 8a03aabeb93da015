package org.lokray.checker.environment.term;

/**
 * Impredicative maximum: {@code imax u v} is {@code 0} whenever {@code v} is {@code 0}.
 */
public final class IMaxLevel implements Level
{
	private final int lhs;
	private final int rhs;

	public IMaxLevel(int lhs, int rhs)
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
