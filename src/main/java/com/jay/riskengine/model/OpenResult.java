package com.jay.riskengine.model;

/**
 * Outcome of an open request: either the new position or the risk rule that refused it.
 * A rejection is an expected outcome; the same trade should not be retried as-is.
 */
public record OpenResult(Position position, String rejectionReason) {

    public static OpenResult opened(Position position) {
        return new OpenResult(position, null);
    }

    public static OpenResult rejected(String reason) {
        return new OpenResult(null, reason);
    }

    public boolean isOpened() {
        return position != null;
    }

    public boolean isRejected() {
        return position == null;
    }
}
