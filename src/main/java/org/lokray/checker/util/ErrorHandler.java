// File: src/main/java/org/lokray/checker/util/ErrorHandler.java
package org.lokray.checker.util;

import org.lokray.checker.parser.ExportParseException;

public class ErrorHandler
{
	private boolean hasErrors = false;

	public void logError(ExportParseException e, String source)
	{
		String err = String.format("[Parse Error] %s - line %d - %s", source, e.getLineNumber(), e.getReason());
		Debug.logError(err);
		hasErrors = true;
	}

	public void logError(String msg)
	{
		Debug.logError("[Error] " + msg);
		hasErrors = true;
	}

	public boolean hasErrors()
	{
		return hasErrors;
	}
}
