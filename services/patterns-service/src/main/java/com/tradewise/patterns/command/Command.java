package com.tradewise.patterns.command;

/**
 * A request captured as an object so it can be retried, queued, audited and undone.
 */
public interface Command {

    String getCommandId();

    CommandResult execute();

    CommandResult undo();

    boolean supportsUndo();
}
