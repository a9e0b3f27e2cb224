package com.tradewise.patterns.command;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CommandResult(boolean success, String errorMessage, Object data) {

    public static CommandResult ok() {
        return new CommandResult(true, null, null);
    }

    public static CommandResult ok(Object data) {
        return new CommandResult(true, null, data);
    }

    public static CommandResult failure(String errorMessage) {
        return new CommandResult(false, errorMessage, null);
    }
}
