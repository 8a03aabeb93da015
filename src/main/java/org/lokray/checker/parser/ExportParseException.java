package org.lokray.checker.parser;

/**
 * Reading an export file stopped at the given line.
 */
public class ExportParseException extends Exception
{
	private final int lineNumber;
	private final String reason;

	public ExportParseException(int lineNumber, String reason, Throwable cause)
	{
		super("Parse error at line " + lineNumber + ": " + reason, cause);
		this.lineNumber = lineNumber;
		this.reason = reason;
	}

	/**
	 * @return the 1-based number of the offending line.
	 */
	public int getLineNumber()
	{
		return lineNumber;
	}

	public String getReason()
	{
		return reason;
	}
}
