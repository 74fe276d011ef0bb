package net.ox.target.python;

import net.ox.ast.Ast;

/**
 * An expression of the Python-like target.
 */
public interface Expr extends Ast {}
