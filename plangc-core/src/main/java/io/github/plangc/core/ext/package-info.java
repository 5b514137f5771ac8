/**
 * Typed metadata on IR objects.
 *
 * <pre>{@code
 * Function policy = module.getFunction("guard");
 * ConstantFolder.INSTANCE.run(policy);
 * int folded = policy.getExtOrThrow(CommonExts.FOLDED_COUNT);
 * }</pre>
 * <p>
 * Passes use exts to publish their results (statistics, diagnostics, analysis results)
 * on the IR they ran over, instead of keeping them in fields of the pass. Pass
 * instances are therefore stateless and can be shared freely between concurrent
 * compilations, while everything a compilation produces stays with its own module.
 */
package io.github.plangc.core.ext;
