package com.componenttrace.core.registry;

/**
 * Outcome of one reconciliation pass.
 *
 * @param promoted     pending records resolved from the snapshot
 * @param refreshed    resolved records whose parent was refreshed
 * @param synthesized  records built for snapshot ids no creation hook reported
 * @param removed      resolved records deleted because the host no longer reports them
 */
public record ReconcileResult(
    Status status,
    int promoted,
    int refreshed,
    int synthesized,
    int removed
) {

    public enum Status {
        APPLIED,
        /** The minimum interval since the previous pass has not elapsed. */
        THROTTLED,
        /** The host does not expose its component tree. */
        UNSUPPORTED,
        FAILED
    }

    public static ReconcileResult throttled() {
        return new ReconcileResult(Status.THROTTLED, 0, 0, 0, 0);
    }

    public static ReconcileResult unsupported() {
        return new ReconcileResult(Status.UNSUPPORTED, 0, 0, 0, 0);
    }

    public static ReconcileResult failed() {
        return new ReconcileResult(Status.FAILED, 0, 0, 0, 0);
    }

    public boolean applied() {
        return status == Status.APPLIED;
    }

    public boolean changedAnything() {
        return promoted + synthesized + removed > 0;
    }
}
