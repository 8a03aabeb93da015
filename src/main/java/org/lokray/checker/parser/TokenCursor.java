package org.lokray.checker.parser;

import org.antlr.v4.runtime.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * Forward only reader over the tokens of one line.
 */
public class TokenCursor
{
	private final List<Token> tokens;
	private int position = 0;

	public TokenCursor(List<Token> tokens)
	{
		this.tokens = tokens;
	}

	public boolean atEnd()
	{
		return position >= tokens.size();
	}

	public boolean nextIsNumber()
	{
		return !atEnd() && peek().getType() == ExportLexer.NAT;
	}

	/**
	 * Consumes the next field, whatever it is.
	 */
	public String nextToken(String expected) throws GrammarException
	{
		if (atEnd())
		{
			throw new GrammarException("Expecting " + expected);
		}
		return tokens.get(position++).getText();
	}

	/**
	 * Consumes the next field as a table index or count.
	 */
	public int nextIndex(String expected) throws GrammarException
	{
		if (atEnd())
		{
			throw new GrammarException("Expecting " + expected);
		}
		Token token = peek();
		int value = token.getType() == ExportLexer.NAT ? parseIndex(token.getText()) : -1;
		if (value < 0)
		{
			throw new GrammarException("Expecting " + expected + ", found '" + token.getText() + "'");
		}
		position++;
		return value;
	}

	/**
	 * Consumes the next field as an unsigned integer that may exceed the index range.
	 */
	public long nextNumber(String expected) throws GrammarException
	{
		if (atEnd())
		{
			throw new GrammarException("Expecting " + expected);
		}
		Token token = peek();
		if (token.getType() == ExportLexer.NAT)
		{
			try
			{
				long value = Long.parseLong(token.getText());
				position++;
				return value;
			}
			catch (NumberFormatException e)
			{
				throw new GrammarException("Integer out of range: " + token.getText());
			}
		}
		throw new GrammarException("Expecting " + expected + ", found '" + token.getText() + "'");
	}

	/**
	 * Consumes indices until the first field that is not one.
	 */
	public List<Integer> remainingIndices(String expected) throws GrammarException
	{
		List<Integer> indices = new ArrayList<>();
		while (nextIsNumber())
		{
			indices.add(nextIndex(expected));
		}
		return indices;
	}

	/**
	 * Fails if anything is left on the line.
	 */
	public void expectEnd() throws GrammarException
	{
		if (!atEnd())
		{
			throw new GrammarException("Expecting end of line, found '" + peek().getText() + "'");
		}
	}

	private Token peek()
	{
		return tokens.get(position);
	}

	private static int parseIndex(String text)
	{
		try
		{
			return Integer.parseInt(text);
		}
		catch (NumberFormatException e)
		{
			return -1;
		}
	}
}
