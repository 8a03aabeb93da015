package org.lokray.checker.environment.term;

public final class ApplicationExpr implements Expr
{
	private final int function;
	private final int argument;

	public ApplicationExpr(int function, int argument)
	{
		this.function = function;
		this.argument = argument;
	}

	public int getFunction()
	{
		return function;
	}

	public int getArgument()
	{
		return argument;
	}
}
