/**
 * Lowering of the policy AST into the IR: one function per policy, one nested function per rule.
 */
package io.github.plangc.core.passes.convert;
