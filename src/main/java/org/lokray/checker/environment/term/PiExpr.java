package org.lokray.checker.environment.term;

/**
 * A dependent function type. The body is the codomain.
 */
public final class PiExpr extends BinderExpr
{
	public PiExpr(BinderInfo info, int name, int domain, int codomain)
	{
		super(info, name, domain, codomain);
	}
}
