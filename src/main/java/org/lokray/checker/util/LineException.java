package org.lokray.checker.util;

/**
 * Raised when a single line of an export file cannot be applied. The reader
 * attaches the line number and stops at the first one.
 */
public abstract class LineException extends Exception
{
	protected LineException(String message)
	{
		super(message);
	}
}
