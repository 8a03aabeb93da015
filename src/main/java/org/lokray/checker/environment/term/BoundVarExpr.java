package org.lokray.checker.environment.term;

public final class BoundVarExpr implements Expr
{
	private final int index;

	public BoundVarExpr(int index)
	{
		this.index = index;
	}

	/**
	 * @return the de Bruijn index, 0 being the innermost enclosing binder.
	 */
	public int getIndex()
	{
		return index;
	}
}
