package com.tradewise.patterns.command;

import java.util.List;

public interface CommandHandler {

    /**
     * Runs the command under the retry policy. Never throws; exhausted failures come back as a failed result.
     */
    CommandResult execute(Command command);

    /**
     * Parks the command for later execution.
     */
    void queue(Command command);

    int queuedCount();

    List<Command> queuedCommands();

    List<CommandAuditEntry> auditLog();
}
