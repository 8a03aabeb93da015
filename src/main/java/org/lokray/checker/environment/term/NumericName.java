package org.lokray.checker.environment.term;

import java.util.Objects;
import java.util.Optional;

/**
 * An integer name segment, created by {@code #NI}. Lean uses these for
 * auxiliary and generated names such as {@code _private.1234.foo}.
 */
public final class NumericName implements Name
{
	private final long value;
	private final Integer parent;

	public NumericName(long value, Optional<Integer> parent)
	{
		this.value = value;
		this.parent = parent.orElse(null);
	}

	public long getValue()
	{
		return value;
	}

	@Override
	public Optional<Integer> getParent()
	{
		return Optional.ofNullable(parent);
	}

	@Override
	public String getSegment()
	{
		return Long.toString(value);
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
		NumericName other = (NumericName) o;
		return value == other.value && Objects.equals(parent, other.parent);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(value, parent);
	}
}
