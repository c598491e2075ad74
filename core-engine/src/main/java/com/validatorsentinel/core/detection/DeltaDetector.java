package com.validatorsentinel.core.detection;

import com.validatorsentinel.core.model.AttributeKind;
import com.validatorsentinel.core.model.AttributeSnapshot;
import com.validatorsentinel.core.model.LivenessKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Write-suppression detector.
 *
 * <p>
 * Decides whether a freshly observed value must be recorded by comparing it
 * with the most recent snapshot of the same entity and attribute. Unchanged
 * values are the dominant case on every sweep and produce no write at all,
 * which is what bounds storage volume.
 * </p>
 *
 * <p>
 * For the MEV attribute {@code null} is a legal "disabled" value and two
 * disabled values are equal. For fee commission {@code null} is malformed.
 * Malformed values are rejected with a logged anomaly so they never enter
 * the history.
 * </p>
 *
 * <p>
 * This is a <strong>stateless</strong> detector.
 * </p>
 *
 * @since 1.0.0
 */
public class DeltaDetector {

    private static final Logger LOG = LoggerFactory.getLogger(DeltaDetector.class);

    /**
     * Decide whether a new attribute value must be written.
     *
     * @param attribute the attribute; must not be {@code null}
     * @param last      most recent snapshot for the entity and attribute, or
     *                  {@code null} if none exists yet
     * @param newValue  the observed value, {@code null} when disabled
     * @return the decision, never {@code null}
     */
    public EmitDecision shouldEmit(AttributeKind attribute, AttributeSnapshot last, Integer newValue) {
        Objects.requireNonNull(attribute, "AttributeKind must not be null");

        if (!isAcceptable(attribute, newValue)) {
            LOG.warn("Rejecting malformed {} value {}{}", attribute, newValue,
                    last != null ? " for " + last.getEntityId() : "");
            return EmitDecision.REJECTED;
        }
        if (last == null) {
            return EmitDecision.FIRST_OBSERVATION;
        }
        if (Objects.equals(last.getValue(), newValue)) {
            return EmitDecision.UNCHANGED;
        }
        LOG.debug("{} of {} changed: {} -> {}", attribute, last.getEntityId(), last.getValue(), newValue);
        return EmitDecision.CHANGED;
    }

    /**
     * @param lastFlag stored delinquency flag
     * @param newFlag  observed delinquency flag
     * @return {@code true} if the flag flipped and a liveness event is due
     */
    public boolean shouldEmitLiveness(boolean lastFlag, boolean newFlag) {
        return lastFlag != newFlag;
    }

    /**
     * @param newFlag the observed delinquency flag after a flip
     * @return the kind of liveness event to record
     */
    public LivenessKind livenessKind(boolean newFlag) {
        return LivenessKind.forFlag(newFlag);
    }

    private static boolean isAcceptable(AttributeKind attribute, Integer value) {
        if (value == null) {
            return attribute.isDisableable();
        }
        return ThresholdClassifier.inRange(value);
    }
}
