/**
 * This package defines the intermediate representation (IR) that PLang policies
 * are compiled to.
 * <p>
 * A {@link io.github.plangc.core.ir.Module} holds one
 * {@link io.github.plangc.core.ir.Function} per policy and per rule. A function is a set of
 * {@link io.github.plangc.core.ir.BasicBlock}s, each a straight-line sequence of
 * {@link io.github.plangc.core.ir.Insn instructions} ending in exactly one terminator:
 * a jump, a conditional jump, a return, or a governance
 * {@link io.github.plangc.core.ir.Action}. Blocks and functions refer to each other by name.
 * <p>
 * Instructions refer to the values of earlier instructions by ID. IDs are handed out by
 * the owning module and never reused, so a pass which replaces an instruction must
 * give the replacement a fresh ID and redirect the old one's uses.
 * <p>
 * The conversion from the parsed AST is handled by
 * {@link io.github.plangc.core.passes.convert.AstToIr}.
 */
package io.github.plangc.core.ir;
