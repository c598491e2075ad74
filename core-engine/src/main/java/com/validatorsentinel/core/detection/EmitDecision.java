package com.validatorsentinel.core.detection;

/**
 * Outcome of {@link DeltaDetector#shouldEmit}.
 *
 * @since 1.0.0
 */
public enum EmitDecision {

    /** Value equals the last snapshot; write nothing. */
    UNCHANGED(false, false),

    /** No prior snapshot; write the snapshot only, as a baseline. */
    FIRST_OBSERVATION(true, true),

    /** Value differs from the last snapshot; write a snapshot and a change event. */
    CHANGED(true, false),

    /** Value outside the attribute's domain; write nothing. */
    REJECTED(false, false);

    private final boolean emit;
    private final boolean firstObservation;

    EmitDecision(boolean emit, boolean firstObservation) {
        this.emit = emit;
        this.firstObservation = firstObservation;
    }

    public boolean emit() {
        return emit;
    }

    public boolean isFirstObservation() {
        return firstObservation;
    }

    /**
     * @return {@code true} if the caller must also classify and record a change event
     */
    public boolean requiresChangeEvent() {
        return this == CHANGED;
    }
}
