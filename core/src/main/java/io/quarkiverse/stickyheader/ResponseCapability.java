package io.quarkiverse.stickyheader;

/**
 * Marker for optional features a {@link ResponseSink} may or may not offer.
 *
 * @see ResponseSink#capability(Class)
 */
public interface ResponseCapability {
}
