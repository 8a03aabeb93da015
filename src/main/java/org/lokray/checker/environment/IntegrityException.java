package org.lokray.checker.environment;

import org.lokray.checker.util.LineException;

/**
 * An insertion would overwrite an existing entry or reference one that does
 * not exist yet. The environment is left untouched when this is thrown.
 */
public class IntegrityException extends LineException
{
	public IntegrityException(String message)
	{
		super(message);
	}
}
