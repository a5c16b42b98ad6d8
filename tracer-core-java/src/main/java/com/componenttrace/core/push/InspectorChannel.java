package com.componenttrace.core.push;

/**
 * Outbound link to a connected inspector.
 */
public interface InspectorChannel {

    /**
     * Delivers one JSON payload.
     *
     * @throws ChannelUnavailableException when the inspector is gone or the session is being torn down
     */
    void send(String payload);

    /** Whether the inspector side has signalled it is ready to receive. */
    default boolean isConnected() {
        return true;
    }
}
