/**
 * {@link io.github.plangc.core.passes.IRPass IR passes} that perform optimisations,
 * or look for opportunities to.
 * <p>
 * None of them may delete an audit-critical instruction.
 */
package io.github.plangc.core.passes.opts;
