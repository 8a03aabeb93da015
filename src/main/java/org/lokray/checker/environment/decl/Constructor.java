package org.lokray.checker.environment.decl;

/**
 * An introduction rule of an inductive type.
 */
public record Constructor(
		int name, // name table index
		int type // expression table index
)
{
}
