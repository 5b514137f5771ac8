/**
 * A configurable API over the lower-level core compiler.
 * <p>
 * The main entrypoint to this API is the
 * {@link io.github.plangc.api.PolicyCompiler},
 * to which parsed PLang programs can be submitted for compilation.
 * <p>
 * The compiler is configured with {@link io.github.plangc.api.CompilerOptions},
 * and can be extended using the {@link io.github.plangc.api.events events API}.
 */
package io.github.plangc.api;
