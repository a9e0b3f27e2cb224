package com.tradewise.common.event;

import java.time.LocalDateTime;

/**
 * A message accepted by an {@link EventPublisher}, as it would have been sent to the broker.
 */
public record PublishedMessage(String topic, String key, String payload, LocalDateTime publishedAt) {
}
