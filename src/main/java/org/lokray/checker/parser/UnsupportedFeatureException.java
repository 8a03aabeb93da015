package org.lokray.checker.parser;

import org.lokray.checker.util.LineException;

/**
 * A command that belongs to the export format but that this reader does not handle yet.
 */
public class UnsupportedFeatureException extends LineException
{
	private final CommandTag tag;

	public UnsupportedFeatureException(CommandTag tag)
	{
		super("Command " + tag.getToken() + " is not supported");
		this.tag = tag;
	}

	public CommandTag getTag()
	{
		return tag;
	}
}
