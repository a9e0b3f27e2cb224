package com.tradewise.patterns.command;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Duration;
import java.time.Instant;

/**
 * One line of the command audit trail. Duration is only set on SUCCESS.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CommandAuditEntry(String commandId, AuditAction action, Instant timestamp, int retryCount, Duration duration) {
}
