/**
 * The abstract syntax tree of PLang, as produced by the parser.
 * <p>
 * The parser lives outside this project; these classes are the shape it
 * hands over. Statement and expression kinds are closed: every consumer
 * dispatches through {@link io.github.plangc.core.ast.StmtVisitor} or
 * {@link io.github.plangc.core.ast.ExprVisitor}, so a new node kind fails
 * to compile until every consumer handles it.
 */
package io.github.plangc.core.ast;
