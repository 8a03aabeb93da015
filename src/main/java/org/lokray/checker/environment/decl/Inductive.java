package org.lokray.checker.environment.decl;

import java.util.List;

/**
 * An inductive type together with its constructors. The first
 * {@code numParams} binders of the type are parameters shared by all constructors.
 */
public final class Inductive implements Declaration
{
	private final int numParams;
	private final int type;
	private final List<Constructor> constructors;
	private final List<Integer> levelParams;

	public Inductive(int numParams, int type, List<Constructor> constructors, List<Integer> levelParams)
	{
		this.numParams = numParams;
		this.type = type;
		this.constructors = List.copyOf(constructors);
		this.levelParams = List.copyOf(levelParams);
	}

	public int getNumParams()
	{
		return numParams;
	}

	@Override
	public int getType()
	{
		return type;
	}

	public List<Constructor> getConstructors()
	{
		return constructors;
	}

	@Override
	public List<Integer> getLevelParams()
	{
		return levelParams;
	}
}
