package org.lokray.checker.environment.term;

public final class SortExpr implements Expr
{
	private final int level;

	public SortExpr(int level)
	{
		this.level = level;
	}

	public int getLevel()
	{
		return level;
	}
}
