package org.lokray.checker.environment.term;

import java.util.List;

/**
 * A reference to a declared constant, instantiated at the given universe levels.
 */
public final class ConstantExpr implements Expr
{
	private final int name;
	private final List<Integer> levels;

	public ConstantExpr(int name, List<Integer> levels)
	{
		this.name = name;
		this.levels = List.copyOf(levels);
	}

	public int getName()
	{
		return name;
	}

	public List<Integer> getLevels()
	{
		return levels;
	}
}
