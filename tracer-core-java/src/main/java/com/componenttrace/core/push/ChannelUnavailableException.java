package com.componenttrace.core.push;

/**
 * The inspector channel cannot deliver, typically during session teardown.
 */
public class ChannelUnavailableException extends RuntimeException {
    public ChannelUnavailableException(String message) { super(message); }
    public ChannelUnavailableException(String message, Throwable cause) { super(message, cause); }
}
