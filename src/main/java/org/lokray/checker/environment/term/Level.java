package org.lokray.checker.environment.term;

/**
 * A universe level. Operands are stored as indices into the level table,
 * parameters as indices into the name table.
 */
public interface Level
{
}
