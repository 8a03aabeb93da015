// File: src/main/java/org/lokray/checker/parser/CommandDispatcher.java
package org.lokray.checker.parser;

import org.antlr.v4.runtime.Token;
import org.lokray.checker.environment.Environment;
import org.lokray.checker.environment.decl.Constructor;
import org.lokray.checker.environment.term.BinderInfo;
import org.lokray.checker.util.LineException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decodes single lines of the export format and applies them to an {@link Environment}.
 * <p>
 * A line whose first field is a number creates a name, level or expression at
 * that index; any other line is a top level declaration. Each command reads a
 * fixed sequence of fields, possibly followed by a list of indices that runs
 * to the end of the line, and nothing may follow what the command consumed.
 * All fields are read and checked before the environment is touched.
 */
public class CommandDispatcher
{
	private final Environment env;
	private final LineTokenizer tokenizer = new LineTokenizer();

	public CommandDispatcher(Environment env)
	{
		this.env = env;
	}

	public Environment getEnvironment()
	{
		return env;
	}

	public void dispatch(String line) throws LineException
	{
		List<Token> tokens = tokenizer.tokenize(line);
		TokenCursor cursor = new TokenCursor(tokens);
		if (cursor.atEnd())
		{
			throw new GrammarException("Expecting index or command");
		}

		if (cursor.nextIsNumber())
		{
			int index = cursor.nextIndex("index");
			String command = cursor.nextToken("index command");
			CommandTag tag = lookupTag(command, true);
			dispatchIndexed(tag, index, cursor);
		}
		else
		{
			String command = cursor.nextToken("command");
			CommandTag tag = lookupTag(command, false);
			dispatchDeclaration(tag, cursor);
		}
	}

	private static CommandTag lookupTag(String command, boolean indexed) throws LineException
	{
		Optional<CommandTag> found = CommandTag.fromToken(command);
		if (found.isEmpty())
		{
			throw new GrammarException((indexed ? "Unknown index command '" : "Unknown command '") + command + "'");
		}
		CommandTag tag = found.get();
		if (tag.isIndexed() != indexed)
		{
			throw new GrammarException(indexed
					? "Command " + command + " does not take an index"
					: "Expecting index before " + command);
		}
		if (!tag.isSupported())
		{
			throw new UnsupportedFeatureException(tag);
		}
		return tag;
	}

	private void dispatchIndexed(CommandTag tag, int index, TokenCursor cursor) throws LineException
	{
		switch (tag)
		{
			case NAME_STRING -> parseNameString(index, cursor);
			case NAME_INTEGER -> parseNameInteger(index, cursor);
			case LEVEL_SUCC -> parseLevelSucc(index, cursor);
			case LEVEL_MAX, LEVEL_IMAX -> parseLevelMax(tag, index, cursor);
			case LEVEL_PARAM -> parseLevelParam(index, cursor);
			case EXPR_SORT -> parseSort(index, cursor);
			case EXPR_BOUND_VAR -> parseBoundVar(index, cursor);
			case EXPR_CONSTANT -> parseConstant(index, cursor);
			case EXPR_APPLICATION -> parseApplication(index, cursor);
			case EXPR_LAMBDA, EXPR_PI -> parseBinder(tag, index, cursor);
			default -> throw new UnsupportedFeatureException(tag);
		}
	}

	private void dispatchDeclaration(CommandTag tag, TokenCursor cursor) throws LineException
	{
		switch (tag)
		{
			case DEFINITION -> parseDefinition(cursor);
			case INDUCTIVE -> parseInductive(cursor);
			default -> throw new UnsupportedFeatureException(tag);
		}
	}

	// The wire format uses 0 for "no parent".
	private static Optional<Integer> parentOf(int parent)
	{
		return parent == Environment.RESERVED_INDEX ? Optional.empty() : Optional.of(parent);
	}

	/*
	 * <nidx'> #NS <nidx> <string>
	 * <nidx'> #NI <nidx> <integer>
	 */

	private void parseNameString(int index, TokenCursor cursor) throws LineException
	{
		int parent = cursor.nextIndex("parent name index");
		String segment = cursor.nextToken("identifier");
		cursor.expectEnd();
		env.addStringName(index, segment, parentOf(parent));
	}

	private void parseNameInteger(int index, TokenCursor cursor) throws LineException
	{
		int parent = cursor.nextIndex("parent name index");
		long value = cursor.nextNumber("integer");
		cursor.expectEnd();
		env.addNumericName(index, value, parentOf(parent));
	}

	/*
	 * <uidx'> #US  <uidx>
	 * <uidx'> #UM  <uidx_1> <uidx_2>
	 * <uidx'> #UIM <uidx_1> <uidx_2>
	 * <uidx'> #UP  <nidx>
	 */

	private void parseLevelSucc(int index, TokenCursor cursor) throws LineException
	{
		int level = cursor.nextIndex("level index");
		cursor.expectEnd();
		env.addLevelSucc(index, level);
	}

	private void parseLevelMax(CommandTag tag, int index, TokenCursor cursor) throws LineException
	{
		int lhs = cursor.nextIndex("level index");
		int rhs = cursor.nextIndex("level index");
		cursor.expectEnd();
		if (tag == CommandTag.LEVEL_MAX)
		{
			env.addLevelMax(index, lhs, rhs);
		}
		else
		{
			env.addLevelIMax(index, lhs, rhs);
		}
	}

	private void parseLevelParam(int index, TokenCursor cursor) throws LineException
	{
		int name = cursor.nextIndex("name index");
		cursor.expectEnd();
		env.addLevelParam(index, name);
	}

	/*
	 * <eidx'> #EV <integer>
	 * <eidx'> #ES <uidx>
	 * <eidx'> #EC <nidx> <uidx>*
	 * <eidx'> #EA <eidx_1> <eidx_2>
	 * <eidx'> #EL <info> <nidx> <eidx_1> <eidx_2>
	 * <eidx'> #EP <info> <nidx> <eidx_1> <eidx_2>
	 */

	private void parseSort(int index, TokenCursor cursor) throws LineException
	{
		int level = cursor.nextIndex("level index");
		cursor.expectEnd();
		env.addExprSort(index, level);
	}

	private void parseBoundVar(int index, TokenCursor cursor) throws LineException
	{
		int deBruijnIndex = cursor.nextIndex("integer");
		cursor.expectEnd();
		env.addExprBoundVar(index, deBruijnIndex);
	}

	private void parseConstant(int index, TokenCursor cursor) throws LineException
	{
		int name = cursor.nextIndex("name index");
		List<Integer> levels = cursor.remainingIndices("level index");
		cursor.expectEnd();
		env.addExprConstant(index, name, levels);
	}

	private void parseApplication(int index, TokenCursor cursor) throws LineException
	{
		int function = cursor.nextIndex("expression index");
		int argument = cursor.nextIndex("expression index");
		cursor.expectEnd();
		env.addExprApplication(index, function, argument);
	}

	private void parseBinder(CommandTag tag, int index, TokenCursor cursor) throws LineException
	{
		String infoToken = cursor.nextToken("binder info");
		BinderInfo info = BinderInfo.fromToken(infoToken)
				.orElseThrow(() -> new GrammarException("Expecting binder info (#BD, #BI, #BS or #BC), found '" + infoToken + "'"));
		int name = cursor.nextIndex("name index");
		int domain = cursor.nextIndex("expression index");
		int body = cursor.nextIndex("expression index");
		cursor.expectEnd();
		if (tag == CommandTag.EXPR_LAMBDA)
		{
			env.addExprLambda(index, info, name, domain, body);
		}
		else
		{
			env.addExprPi(index, info, name, domain, body);
		}
	}

	// #DEF <nidx> <eidx_1> <eidx_2> <nidx>*
	private void parseDefinition(TokenCursor cursor) throws LineException
	{
		int name = cursor.nextIndex("name index");
		int type = cursor.nextIndex("expression index");
		int value = cursor.nextIndex("expression index");
		List<Integer> levelParams = cursor.remainingIndices("name index");
		cursor.expectEnd();
		env.addDefinition(name, type, value, levelParams);
	}

	// #IND <num> <nidx> <eidx> <num_intros> (<nidx> <eidx>){num_intros} <nidx>*
	private void parseInductive(TokenCursor cursor) throws LineException
	{
		int numParams = cursor.nextIndex("number of parameters");
		int name = cursor.nextIndex("name index");
		int type = cursor.nextIndex("expression index");
		int numIntros = cursor.nextIndex("number of constructors");
		List<Constructor> constructors = new ArrayList<>();
		for (int i = 0; i < numIntros; i++)
		{
			int ctorName = cursor.nextIndex("constructor name index");
			int ctorType = cursor.nextIndex("constructor type index");
			constructors.add(new Constructor(ctorName, ctorType));
		}
		List<Integer> levelParams = cursor.remainingIndices("name index");
		cursor.expectEnd();
		env.addInductive(numParams, name, type, constructors, levelParams);
	}
}
