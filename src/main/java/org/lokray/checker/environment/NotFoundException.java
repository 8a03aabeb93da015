package org.lokray.checker.environment;

/**
 * A lookup was made for an index that is not in its table.
 */
public class NotFoundException extends RuntimeException
{
	public NotFoundException(String table, int index)
	{
		super(table + " " + index + " not found");
	}
}
