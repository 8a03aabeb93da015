package org.lokray.checker.environment.term;

import java.util.Objects;
import java.util.Optional;

/**
 * A textual name segment, created by {@code #NS}.
 */
public final class StringName implements Name
{
	private final String segment;
	private final Integer parent;

	public StringName(String segment, Optional<Integer> parent)
	{
		this.segment = Objects.requireNonNull(segment, "segment");
		this.parent = parent.orElse(null);
	}

	@Override
	public Optional<Integer> getParent()
	{
		return Optional.ofNullable(parent);
	}

	@Override
	public String getSegment()
	{
		return segment;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (o == null || getClass() != o.getClass())
		{
			return false;
		}
		StringName other = (StringName) o;
		return segment.equals(other.segment) && Objects.equals(parent, other.parent);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(segment, parent);
	}
}
