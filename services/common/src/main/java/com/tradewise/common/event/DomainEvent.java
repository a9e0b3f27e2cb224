package com.tradewise.common.event;

import java.time.LocalDateTime;

public interface DomainEvent {
    String getEventId();
    String getEventType();
    LocalDateTime getTimestamp();
    String getTopic();
}
