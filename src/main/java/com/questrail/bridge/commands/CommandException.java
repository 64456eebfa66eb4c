package com.questrail.bridge.commands;

import com.questrail.bridge.api.BridgeException;

/**
 * A UI command could not run (no profile selected, unreadable path, ...).
 */
public final class CommandException extends BridgeException
{
    public CommandException(String message) {
        super(message);
    }

    public CommandException(String message, Throwable cause) {
        super(message, cause);
    }
}
