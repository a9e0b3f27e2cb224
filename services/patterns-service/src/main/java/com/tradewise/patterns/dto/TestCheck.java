package com.tradewise.patterns.dto;

public record TestCheck(String name, boolean pass, String details) {
}
