package io.github.plangc.api.events;

import io.github.plangc.api.PolicyCompiler;

/**
 * An event fired on the {@link PolicyCompiler} itself.
 */
public interface CompilerEvent {
}
