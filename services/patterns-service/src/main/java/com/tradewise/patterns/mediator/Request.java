package com.tradewise.patterns.mediator;

/**
 * Marker for a message routed by the {@link Mediator}.
 *
 * @param <R> response type
 */
public interface Request<R> {
}
