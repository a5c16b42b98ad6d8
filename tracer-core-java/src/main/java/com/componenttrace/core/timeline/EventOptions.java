package com.componenttrace.core.timeline;

/**
 * Optional attributes of a recorded event.
 */
public record EventOptions(
    Double durationMs,
    boolean async,
    boolean firstRender,
    boolean suppressed,
    boolean enhanced,
    String details
) {

    public static final EventOptions NONE = new EventOptions(null, false, false, false, true, null);

    public static EventOptions duration(double durationMs) {
        return NONE.withDuration(durationMs);
    }

    public EventOptions withDuration(Double durationMs) {
        return new EventOptions(durationMs, async, firstRender, suppressed, enhanced, details);
    }

    public EventOptions asAsync() {
        return new EventOptions(durationMs, true, firstRender, suppressed, enhanced, details);
    }

    public EventOptions asFirstRender() {
        return new EventOptions(durationMs, async, true, suppressed, enhanced, details);
    }

    public EventOptions asFirstRender(boolean firstRender) {
        return new EventOptions(durationMs, async, firstRender, suppressed, enhanced, details);
    }

    public EventOptions asSuppressed() {
        return new EventOptions(durationMs, async, firstRender, true, enhanced, details);
    }

    public EventOptions asBasic() {
        return new EventOptions(durationMs, async, firstRender, suppressed, false, details);
    }

    public EventOptions withDetails(String details) {
        return new EventOptions(durationMs, async, firstRender, suppressed, enhanced, details);
    }
}
