package com.unihousing.backend.modules.clearance.domain;

/**
 * Progress derived from the two checkpoints. Nothing here is stored; status and percentage
 * are recomputed on every read.
 */
public record ClearanceProgress(boolean initiated, boolean roomCheckPassed, boolean keysReturned) {

    private static final int CHECKPOINTS = 2;

    public static ClearanceProgress notInitiated() {
        return new ClearanceProgress(false, false, false);
    }

    public static ClearanceProgress of(ClearanceProcess process) {
        return new ClearanceProgress(true, process.isRoomCheckPassed(), process.isKeysReturned());
    }

    public int completedCheckpoints() {
        int completed = 0;
        if (roomCheckPassed) {
            completed++;
        }
        if (keysReturned) {
            completed++;
        }
        return completed;
    }

    public int percentage() {
        return completedCheckpoints() * 100 / CHECKPOINTS;
    }

    public ClearanceStatus status() {
        if (!initiated) {
            return ClearanceStatus.NOT_INITIATED;
        }
        return completedCheckpoints() == CHECKPOINTS ? ClearanceStatus.COMPLETED : ClearanceStatus.PENDING;
    }
}
