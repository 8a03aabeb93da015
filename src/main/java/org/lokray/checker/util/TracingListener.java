package org.lokray.checker.util;

import org.lokray.checker.environment.Environment;
import org.lokray.checker.environment.EnvironmentListener;
import org.lokray.checker.environment.decl.Declaration;
import org.lokray.checker.environment.term.Expr;
import org.lokray.checker.environment.term.Level;
import org.lokray.checker.environment.term.Name;

/**
 * Prints every entry as soon as it has been added, e.g. {@code Expr 7: Sort 0}.
 */
public class TracingListener implements EnvironmentListener
{
	@Override
	public void nameAdded(Environment env, int index, Name name)
	{
		Debug.log("Name " + index + ": " + env.renderName(index));
	}

	@Override
	public void levelAdded(Environment env, int index, Level level)
	{
		Debug.log("Level " + index + ": " + env.renderLevel(index));
	}

	@Override
	public void exprAdded(Environment env, int index, Expr expr)
	{
		Debug.log("Expr " + index + ": " + env.renderExpr(index));
	}

	@Override
	public void declarationAdded(Environment env, int nameIndex, Declaration declaration)
	{
		Debug.log("Declaration " + nameIndex + ": " + env.renderDeclaration(nameIndex));
	}
}
