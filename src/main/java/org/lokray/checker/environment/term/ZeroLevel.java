package org.lokray.checker.environment.term;

/**
 * The level {@code 0}. It always lives at index 0 of the level table.
 */
public final class ZeroLevel implements Level
{
	public static final ZeroLevel INSTANCE = new ZeroLevel();

	private ZeroLevel()
	{
	}
}
