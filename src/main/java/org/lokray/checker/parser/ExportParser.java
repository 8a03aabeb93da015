package org.lokray.checker.parser;

import org.lokray.checker.environment.Environment;
import org.lokray.checker.util.Debug;
import org.lokray.checker.util.LineException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;

/**
 * Reads a whole export file into an {@link Environment}, one line at a time,
 * and stops at the first line that cannot be applied.
 */
public class ExportParser
{
	private final CommandDispatcher dispatcher;
	private int linesRead = 0;

	public ExportParser()
	{
		this(new Environment());
	}

	public ExportParser(Environment env)
	{
		this.dispatcher = new CommandDispatcher(env);
	}

	/**
	 * @return the environment holding every entry read so far.
	 * @throws ExportParseException for the first line that is malformed, refers
	 *                              to something undefined or uses an unsupported command.
	 */
	public Environment parse(Reader input) throws ExportParseException
	{
		BufferedReader reader = input instanceof BufferedReader br ? br : new BufferedReader(input);
		int lineNumber = linesRead + 1;
		try
		{
			String line;
			while ((line = readLine(reader)) != null)
			{
				dispatcher.dispatch(line);
				linesRead = lineNumber;
				lineNumber++;
			}
		}
		catch (LineException e)
		{
			Debug.logDebug("Rejected line " + lineNumber + " (" + e.getClass().getSimpleName() + ")");
			throw new ExportParseException(lineNumber, e.getMessage(), e);
		}
		catch (IOException e)
		{
			throw new ExportParseException(lineNumber, "Read failed: " + e.getMessage(), e);
		}
		return dispatcher.getEnvironment();
	}

	/**
	 * Reads up to the next line feed. A carriage return right before it is
	 * dropped; anywhere else it stays in the line and counts as whitespace.
	 *
	 * @return the line, or null at the end of the input.
	 */
	private static String readLine(BufferedReader reader) throws IOException
	{
		StringBuilder line = new StringBuilder();
		int c;
		while ((c = reader.read()) != -1)
		{
			if (c == '\n')
			{
				int last = line.length() - 1;
				if (last >= 0 && line.charAt(last) == '\r')
				{
					line.setLength(last);
				}
				return line.toString();
			}
			line.append((char) c);
		}
		return line.length() == 0 ? null : line.toString();
	}

	/**
	 * @return the number of lines successfully applied.
	 */
	public int getLinesRead()
	{
		return linesRead;
	}
}
