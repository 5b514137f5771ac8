package io.github.plangc.api.events;

import io.github.plangc.api.PolicyCompilation;

/**
 * Marker for the events a {@link PolicyCompilation} fires, one per pipeline stage.
 */
public interface ModuleCompileEvent {
}
