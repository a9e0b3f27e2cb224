package com.tradewise.common.domain;

public enum OrderSide {
    BUY,
    SELL
}
