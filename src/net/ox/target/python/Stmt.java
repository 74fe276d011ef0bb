package net.ox.target.python;

import net.ox.ast.Ast;

/**
 * A statement of the Python-like target.
 */
public interface Stmt extends Ast {}
