package com.example.canarycontroller.canary;

/**
 * What the caller must do to the workload after an engine operation.
 */
public record TrafficAction(Type type, int canaryPercent, String rollbackId) {

    public enum Type {
        NONE, APPLY_SPLIT, PROMOTE, REVERT_TO_STABLE
    }

    public static TrafficAction none() {
        return new TrafficAction(Type.NONE, 0, null);
    }

    public static TrafficAction applySplit(int canaryPercent) {
        return new TrafficAction(Type.APPLY_SPLIT, canaryPercent, null);
    }

    public static TrafficAction promote() {
        return new TrafficAction(Type.PROMOTE, 100, null);
    }

    public static TrafficAction revertToStable(String rollbackId) {
        return new TrafficAction(Type.REVERT_TO_STABLE, 0, rollbackId);
    }

    public boolean isNone() {
        return type == Type.NONE;
    }
}
