package com.tradewise.patterns.mediator;

public interface RequestHandler<Q extends Request<R>, R> {

    /**
     * Request class this handler is registered for.
     */
    Class<Q> requestType();

    R handle(Q request);
}
