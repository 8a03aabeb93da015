package org.lokray.checker.parser;

import org.lokray.checker.util.LineException;

/**
 * A line does not follow the grammar of its command.
 */
public class GrammarException extends LineException
{
	public GrammarException(String message)
	{
		super(message);
	}
}
