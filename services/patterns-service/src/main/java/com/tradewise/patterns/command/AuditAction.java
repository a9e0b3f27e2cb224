package com.tradewise.patterns.command;

public enum AuditAction {
    EXECUTE,
    SUCCESS,
    FAILED,
    EXCEPTION,
    QUEUED
}
