package com.componenttrace.core.timeline;

import java.util.List;

/**
 * Events produced within one host render pass.
 *
 * @param startEventId  id of the batch-started event, or -1 if it was not recorded
 * @param endRelativeMs null while the batch is still open
 */
public record RenderBatch(
    long batchId,
    long startEventId,
    double startRelativeMs,
    Double endRelativeMs,
    List<Integer> componentIds,
    String triggerSource
) {

    public RenderBatch {
        componentIds = componentIds != null ? List.copyOf(componentIds) : List.of();
    }

    public Double durationMs() {
        return endRelativeMs != null ? endRelativeMs - startRelativeMs : null;
    }

    public int componentCount() {
        return componentIds.size();
    }

    public boolean isOpen() {
        return endRelativeMs == null;
    }

    RenderBatch complete(double endRelativeMs, List<Integer> componentIds) {
        return new RenderBatch(batchId, startEventId, startRelativeMs, endRelativeMs, componentIds, triggerSource);
    }
}
