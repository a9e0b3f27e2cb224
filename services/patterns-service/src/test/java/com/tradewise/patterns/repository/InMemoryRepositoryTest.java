package com.tradewise.patterns.repository;

import com.tradewise.common.domain.Order;
import com.tradewise.common.domain.OrderSide;
import com.tradewise.common.domain.OrderStatus;
import com.tradewise.common.error.ResourceNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the in-memory repository and unit of work
 */
@DisplayName("In-Memory Repository Unit Tests")
class InMemoryRepositoryTest {

    private Repository<Order, String> repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryRepository<>(Order::getOrderId);
    }

    // ==================== Repository ====================

    @Nested
    @DisplayName("Repository")
    class RepositoryOperations {

        @Test
        @DisplayName("Add then find returns the entity")
        void addAndFind() {
            Order order = order("ORD-1");

            repository.add(order);

            assertThat(repository.findById("ORD-1")).contains(order);
            assertThat(repository.exists("ORD-1")).isTrue();
            assertThat(repository.findAll()).containsExactly(order);
        }

        @Test
        @DisplayName("Update replaces an existing entity")
        void updateReplaces() {
            repository.add(order("ORD-1"));

            repository.update(order("ORD-1").withStatus(OrderStatus.PLACED));

            assertThat(repository.findById("ORD-1")).get()
                .extracting(Order::getStatus).isEqualTo(OrderStatus.PLACED);
        }

        @Test
        @DisplayName("Update of a missing entity fails and stores nothing")
        void updateMissing() {
            assertThatThrownBy(() -> repository.update(order("ORD-404")))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Entity with key ORD-404 not found");
            assertThat(repository.exists("ORD-404")).isFalse();
        }

        @Test
        @DisplayName("Delete is idempotent")
        void deleteIdempotent() {
            repository.add(order("ORD-1"));

            repository.delete("ORD-1");
            repository.delete("ORD-1");

            assertThat(repository.findById("ORD-1")).isEmpty();
        }
    }

    // ==================== Unit of work ====================

    @Nested
    @DisplayName("Unit of work")
    class UnitOfWorkOperations {

        private final UnitOfWork unitOfWork = new InMemoryUnitOfWork();

        @Test
        @DisplayName("Changes inside a unit wait for saveChanges")
        void defersChanges() {
            unitOfWork.begin();
            unitOfWork.registerChange(() -> repository.add(order("ORD-1")));
            unitOfWork.registerChange(() -> repository.add(order("ORD-2")));

            assertThat(repository.findAll()).isEmpty();
            assertThat(unitOfWork.pendingChangeCount()).isEqualTo(2);

            assertThat(unitOfWork.saveChanges()).isEqualTo(2);
            assertThat(repository.findAll()).hasSize(2);
            assertThat(unitOfWork.pendingChangeCount()).isZero();
        }

        @Test
        @DisplayName("Rollback discards pending changes")
        void rollbackDiscards() {
            unitOfWork.begin();
            unitOfWork.registerChange(() -> repository.add(order("ORD-1")));

            unitOfWork.rollback();

            assertThat(unitOfWork.pendingChangeCount()).isZero();
            assertThat(repository.findAll()).isEmpty();
        }

        @Test
        @DisplayName("Changes outside a unit apply immediately")
        void appliesImmediatelyOutsideUnit() {
            unitOfWork.registerChange(() -> repository.add(order("ORD-1")));

            assertThat(repository.exists("ORD-1")).isTrue();
            assertThat(unitOfWork.saveChanges()).isZero();
        }
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
