package org.lokray.checker.parser;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits one line of an export file into its whitespace separated fields
 * using the generated {@link ExportLexer}. Every character belongs to either
 * a field or a separator, so there is no lexing error to report; field level
 * problems are found later by {@link TokenCursor}.
 */
public class LineTokenizer
{
	public List<Token> tokenize(String line)
	{
		ExportLexer lexer = new ExportLexer(CharStreams.fromString(line));

		// No console output from ANTLR
		lexer.removeErrorListeners();

		return new ArrayList<>(lexer.getAllTokens());
	}
}
