package com.tradewise.common.domain;

import java.time.Instant;

public record LedgerEntry(String entryId, String accountId, Money amount, EntryType type, Instant createdAt) {

    public enum EntryType {
        DEBIT,
        CREDIT
    }
}
