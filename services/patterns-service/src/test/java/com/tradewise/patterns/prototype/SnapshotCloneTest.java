package com.tradewise.patterns.prototype;

import com.tradewise.common.domain.Order;
import com.tradewise.common.domain.OrderSide;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Snapshot Clone Unit Tests")
class SnapshotCloneTest {

    @Test
    @DisplayName("Order snapshot clone owns its metadata")
    void orderSnapshotMetadataIndependent() {
        OrderSnapshot original = new OrderSnapshot(order("ORD-1"), Map.of("BacktestId", "BT-001"));

        OrderSnapshot clone = original.deepClone();
        clone.getMetadata().put("ModifiedInClone", true);

        assertThat(original.getMetadata()).containsOnlyKeys("BacktestId");
        assertThat(clone.getMetadata()).containsKeys("BacktestId", "ModifiedInClone");
        assertThat(clone.getOrder()).isEqualTo(original.getOrder()).isNotSameAs(original.getOrder());
        assertThat(clone.getSnapshotTimestamp()).isAfterOrEqualTo(original.getSnapshotTimestamp());
    }

    @Test
    @DisplayName("Portfolio clone copies orders and positions")
    void portfolioCloneIndependent() {
        PortfolioSnapshot original = new PortfolioSnapshot(
            List.of(new OrderSnapshot(order("ORD-1")), new OrderSnapshot(order("ORD-2"))),
            Map.of("AAPL", new BigDecimal("100")),
            new BigDecimal("50000"));

        PortfolioSnapshot clone = original.deepClone();
        clone.getPositions().put("MSFT", new BigDecimal("10"));
        clone.getOrders().get(0).getMetadata().put("Note", "clone only");

        assertThat(original.getPositions()).containsOnlyKeys("AAPL");
        assertThat(original.getOrders().get(0).getMetadata()).isEmpty();
        assertThat(clone.getOrders()).hasSize(2);
        assertThat(clone.getOrders().get(0)).isNotSameAs(original.getOrders().get(0));
        assertThat(clone.getCashBalance()).isEqualByComparingTo("50000");
    }

    private static Order order(String orderId) {
        return Order.builder()
            .orderId(orderId)
            .accountId("ACC-001")
            .symbol("AAPL")
            .side(OrderSide.BUY)
            .quantity(100)
            .price(new BigDecimal("150"))
            .build();
    }
}
