package org.lokray.checker.environment.term;

/**
 * Common shape of lambda abstractions and pi types: a named, annotated binder
 * with a domain, and a body in which the binder is de Bruijn index 0.
 */
public abstract class BinderExpr implements Expr
{
	private final BinderInfo info;
	private final int name;
	private final int domain;
	private final int body;

	protected BinderExpr(BinderInfo info, int name, int domain, int body)
	{
		this.info = info;
		this.name = name;
		this.domain = domain;
		this.body = body;
	}

	public BinderInfo getInfo()
	{
		return info;
	}

	public int getName()
	{
		return name;
	}

	public int getDomain()
	{
		return domain;
	}

	public int getBody()
	{
		return body;
	}
}
