package org.lokray.checker.environment.decl;

import java.util.List;

public final class Definition implements Declaration
{
	private final int type;
	private final int value;
	private final List<Integer> levelParams;

	public Definition(int type, int value, List<Integer> levelParams)
	{
		this.type = type;
		this.value = value;
		this.levelParams = List.copyOf(levelParams);
	}

	@Override
	public int getType()
	{
		return type;
	}

	public int getValue()
	{
		return value;
	}

	@Override
	public List<Integer> getLevelParams()
	{
		return levelParams;
	}
}
