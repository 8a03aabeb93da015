package org.lokray.checker.environment.term;

import java.util.Optional;

/**
 * One segment of a hierarchical name. The full name is obtained by following
 * the parent chain up to a root segment.
 */
public interface Name
{
	/**
	 * @return the index of the enclosing name, or empty for a root segment.
	 */
	Optional<Integer> getParent();

	/**
	 * @return the segment exactly as it is displayed.
	 */
	String getSegment();
}
