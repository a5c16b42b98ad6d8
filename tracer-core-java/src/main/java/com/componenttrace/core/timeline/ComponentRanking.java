package com.componenttrace.core.timeline;

/**
 * Render time aggregated over the recorded render events of one component.
 */
public record ComponentRanking(
    int componentId,
    String componentName,
    double totalRenderMs,
    int renderCount,
    double averageRenderMs,
    double maxRenderMs,
    double minRenderMs
) {}
