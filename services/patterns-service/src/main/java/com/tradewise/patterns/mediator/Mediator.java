package com.tradewise.patterns.mediator;

public interface Mediator {

    /**
     * @throws IllegalStateException if no handler is registered for the request's class
     */
    <R> R send(Request<R> request);
}
