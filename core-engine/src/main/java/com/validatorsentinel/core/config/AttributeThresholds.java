package com.validatorsentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Classification thresholds for one tracked attribute, in percentage points.
 *
 * <p>
 * Call {@link #validate(String)} after construction / deserialization to
 * verify every threshold lies within the 0 to 100 commission domain.
 * </p>
 *
 * @since 1.0.0
 */
public class AttributeThresholds implements Serializable {

    private static final long serialVersionUID = 1L;

    /** A new value at or above this level, reached by an increase, is a rug. */
    private int rugLevel = 90;

    /** An increase of at least this many points is a caution. */
    private int cautionDelta = 10;

    /**
     * Enabling a disabled attribute directly at or above this level is a
     * caution. Only meaningful for attributes that can be disabled.
     */
    private int enableCautionLevel = 90;

    public AttributeThresholds() {
    }

    public AttributeThresholds(int rugLevel, int cautionDelta, int enableCautionLevel) {
        this.rugLevel = rugLevel;
        this.cautionDelta = cautionDelta;
        this.enableCautionLevel = enableCautionLevel;
    }

    /**
     * @param name attribute name used in error messages
     * @return list of validation errors; empty when valid
     */
    public List<String> validate(String name) {
        List<String> errors = new ArrayList<>();
        if (rugLevel < 1 || rugLevel > 100) {
            errors.add("'" + name + ".rugLevel' must be in [1, 100], got: " + rugLevel);
        }
        if (cautionDelta < 1 || cautionDelta > 100) {
            errors.add("'" + name + ".cautionDelta' must be in [1, 100], got: " + cautionDelta);
        }
        if (enableCautionLevel < 0 || enableCautionLevel > 100) {
            errors.add("'" + name + ".enableCautionLevel' must be in [0, 100], got: " + enableCautionLevel);
        }
        return errors;
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public int getRugLevel() {
        return rugLevel;
    }

    public void setRugLevel(int rugLevel) {
        this.rugLevel = rugLevel;
    }

    public int getCautionDelta() {
        return cautionDelta;
    }

    public void setCautionDelta(int cautionDelta) {
        this.cautionDelta = cautionDelta;
    }

    public int getEnableCautionLevel() {
        return enableCautionLevel;
    }

    public void setEnableCautionLevel(int enableCautionLevel) {
        this.enableCautionLevel = enableCautionLevel;
    }

    @Override
    public String toString() {
        return "AttributeThresholds{" +
                "rugLevel=" + rugLevel +
                ", cautionDelta=" + cautionDelta +
                ", enableCautionLevel=" + enableCautionLevel +
                '}';
    }
}
