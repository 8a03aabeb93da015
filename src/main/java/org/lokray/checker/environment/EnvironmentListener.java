package org.lokray.checker.environment;

import org.lokray.checker.environment.decl.Declaration;
import org.lokray.checker.environment.term.Expr;
import org.lokray.checker.environment.term.Level;
import org.lokray.checker.environment.term.Name;

/**
 * Notified after each successful insertion into an {@link Environment}.
 */
public interface EnvironmentListener
{
	default void nameAdded(Environment env, int index, Name name)
	{
	}

	default void levelAdded(Environment env, int index, Level level)
	{
	}

	default void exprAdded(Environment env, int index, Expr expr)
	{
	}

	default void declarationAdded(Environment env, int nameIndex, Declaration declaration)
	{
	}
}
