package org.lokray.checker.environment.decl;

import java.util.List;

/**
 * A top level declaration, keyed in the environment by the index of the name
 * it declares.
 */
public interface Declaration
{
	/**
	 * @return the expression index of the declared type.
	 */
	int getType();

	/**
	 * @return the universe level parameters, as name indices, in declaration order.
	 */
	List<Integer> getLevelParams();
}
