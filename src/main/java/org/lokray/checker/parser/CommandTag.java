package org.lokray.checker.parser;

import java.util.Optional;

/**
 * Every command of the export format.
 * <p>
 * Indexed commands follow the index of the entry they create
 * ({@code 3 #NS 1 foo}); top level commands start the line ({@code #DEF ...}).
 * Commands that are part of the format but not handled by this reader are
 * listed too, so they are reported as unsupported rather than unknown.
 */
public enum CommandTag
{
	// Names
	NAME_STRING("#NS", true, true),
	NAME_INTEGER("#NI", true, true),

	// Universe levels
	LEVEL_SUCC("#US", true, true),
	LEVEL_MAX("#UM", true, true),
	LEVEL_IMAX("#UIM", true, true),
	LEVEL_PARAM("#UP", true, true),

	// Expressions
	EXPR_SORT("#ES", true, true),
	EXPR_BOUND_VAR("#EV", true, true),
	EXPR_CONSTANT("#EC", true, true),
	EXPR_APPLICATION("#EA", true, true),
	EXPR_LAMBDA("#EL", true, true),
	EXPR_PI("#EP", true, true),
	EXPR_PROJECTION("#EJ", true, false),
	EXPR_NAT_LITERAL("#ELN", true, false),
	EXPR_STRING_LITERAL("#ELS", true, false),
	EXPR_LET("#EZ", true, false),

	// Declarations
	DEFINITION("#DEF", false, true),
	INDUCTIVE("#IND", false, true),
	AXIOM("#AX", false, false),
	QUOTIENT("#QUOT", false, false),

	// Notations
	PREFIX("#PREFIX", false, false),
	POSTFIX("#POSTFIX", false, false),
	INFIX("#INFIX", false, false);

	private final String token;
	private final boolean indexed;
	private final boolean supported;

	CommandTag(String token, boolean indexed, boolean supported)
	{
		this.token = token;
		this.indexed = indexed;
		this.supported = supported;
	}

	public String getToken()
	{
		return token;
	}

	/**
	 * @return true if the command is preceded by the index of the entry it creates.
	 */
	public boolean isIndexed()
	{
		return indexed;
	}

	public boolean isSupported()
	{
		return supported;
	}

	public static Optional<CommandTag> fromToken(String token)
	{
		for (CommandTag tag : values())
		{
			if (tag.token.equals(token))
			{
				return Optional.of(tag);
			}
		}
		return Optional.empty();
	}
}
