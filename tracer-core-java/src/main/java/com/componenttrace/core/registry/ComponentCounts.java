package com.componenttrace.core.registry;

import com.google.gson.annotations.SerializedName;

/**
 * Resolved and pending record counts for one session.
 */
public record ComponentCounts(
    @SerializedName("resolved") int resolved,
    @SerializedName("pending") int pending,
    @SerializedName("total") int total
) {

    public static ComponentCounts of(int resolved, int pending) {
        return new ComponentCounts(resolved, pending, resolved + pending);
    }
}
