package org.lokray.checker.environment.term;

public final class LambdaExpr extends BinderExpr
{
	public LambdaExpr(BinderInfo info, int name, int domain, int body)
	{
		super(info, name, domain, body);
	}
}
