/**
 * Hooks into a policy compilation.
 * <p>
 * A {@link io.github.plangc.api.PolicyCompiler} fires {@link io.github.plangc.api.events.CompilerEvent}s,
 * and each {@link io.github.plangc.api.PolicyCompilation} fires
 * {@link io.github.plangc.api.events.ModuleCompileEvent}s as its module moves through the stages.
 * Listeners on the IR events may inspect the module, run their own passes over it, or swap it out.
 */
package io.github.plangc.api.events;
