package com.tradewise.patterns.mediator;

import com.tradewise.common.domain.Order;
import com.tradewise.patterns.repository.Repository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class GetOrderHandler implements RequestHandler<GetOrderRequest, Optional<Order>> {

    private final Repository<Order, String> orderStore;

    @Override
    public Class<GetOrderRequest> requestType() {
        return GetOrderRequest.class;
    }

    @Override
    public Optional<Order> handle(GetOrderRequest request) {
        log.info("Handling GetOrderRequest for {}", request.orderId());
        return orderStore.findById(request.orderId());
    }
}
