package org.lokray.checker.environment.term;

import java.util.Optional;

/**
 * How a binder was written. Only affects the delimiters used when printing.
 */
public enum BinderInfo
{
	DEFAULT("#BD", "(", ")"),
	IMPLICIT("#BI", "{", "}"),
	STRICT_IMPLICIT("#BS", "{{", "}}"),
	INST_IMPLICIT("#BC", "[", "]");

	private final String token;
	private final String open;
	private final String close;

	BinderInfo(String token, String open, String close)
	{
		this.token = token;
		this.open = open;
		this.close = close;
	}

	public String getToken()
	{
		return token;
	}

	public String getOpen()
	{
		return open;
	}

	public String getClose()
	{
		return close;
	}

	public static Optional<BinderInfo> fromToken(String token)
	{
		for (BinderInfo info : values())
		{
			if (info.token.equals(token))
			{
				return Optional.of(info);
			}
		}
		return Optional.empty();
	}
}
