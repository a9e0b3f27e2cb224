package com.tradewise.patterns.mediator;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Routes requests through a table of handlers keyed by request class. The table is built once
 * from the handler beans; registering two handlers for one request class fails startup.
 */
@Slf4j
@Component
public class RegistryMediator implements Mediator {

    private final Map<Class<?>, RequestHandler<?, ?>> handlers;

    public RegistryMediator(List<RequestHandler<?, ?>> requestHandlers) {
        Map<Class<?>, RequestHandler<?, ?>> registry = new HashMap<>();
        for (RequestHandler<?, ?> handler : requestHandlers) {
            RequestHandler<?, ?> existing = registry.putIfAbsent(handler.requestType(), handler);
            if (existing != null) {
                throw new IllegalStateException(String.format("Duplicate handler for request type %s: %s and %s",
                    handler.requestType().getSimpleName(),
                    existing.getClass().getSimpleName(), handler.getClass().getSimpleName()));
            }
        }
        this.handlers = Map.copyOf(registry);
        log.info("Mediator initialized with {} request handlers", handlers.size());
    }

    @Override
    @SuppressWarnings("unchecked")
    public <R> R send(Request<R> request) {
        RequestHandler<Request<R>, R> handler = (RequestHandler<Request<R>, R>) handlers.get(request.getClass());
        if (handler == null) {
            throw new IllegalStateException("No handler found for request type " + request.getClass().getSimpleName());
        }
        log.debug("Mediator routing request {} to handler {}",
            request.getClass().getSimpleName(), handler.getClass().getSimpleName());
        return handler.handle(request);
    }
}
