package com.tradewise.patterns.adapter;

/**
 * Quote as returned by the legacy feed: raw doubles and an epoch-millisecond timestamp.
 */
public record LegacyQuote(String symbol, double bid, double ask, long epochMillis) {
}
