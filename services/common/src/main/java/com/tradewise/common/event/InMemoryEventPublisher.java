package com.tradewise.common.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Event publisher that serializes events with Jackson and records them in memory
 * instead of handing them to a broker.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InMemoryEventPublisher implements EventPublisher {

    private final ObjectMapper objectMapper;

    private final List<PublishedMessage> publishedMessages = new CopyOnWriteArrayList<>();

    @Override
    public void publishDomainEvent(String topic, DomainEvent event) {
        try {
            String eventJson = objectMapper.writeValueAsString(event);
            record(topic, event.getEventId(), eventJson);
            log.info("Published domain event: topic={}, type={}, eventId={}",
                    topic, event.getEventType(), event.getEventId());
        } catch (JsonProcessingException e) {
            log.error("Failed to publish domain event: topic={}, type={}",
                    topic, event.getEventType(), e);
        }
    }

    @Override
    public List<PublishedMessage> getPublishedMessages() {
        return List.copyOf(publishedMessages);
    }

    public void clear() {
        publishedMessages.clear();
    }

    private void record(String topic, String key, String payload) {
        publishedMessages.add(new PublishedMessage(topic, key, payload, LocalDateTime.now()));
    }
}
