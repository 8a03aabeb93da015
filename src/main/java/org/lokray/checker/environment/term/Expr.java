package org.lokray.checker.environment.term;

/**
 * A term of the expression table. Sub-terms are referenced by their index in
 * that table; bound variables are de Bruijn indices and are only resolved
 * when the term is printed.
 */
public interface Expr
{
}
