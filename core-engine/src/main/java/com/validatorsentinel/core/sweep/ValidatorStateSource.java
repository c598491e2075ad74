package com.validatorsentinel.core.sweep;

import com.validatorsentinel.core.model.ValidatorObservation;

import java.util.List;

/**
 * Supplies the current state of every tracked validator, one observation
 * per validator, at the start of a sweep.
 *
 * @since 1.0.0
 */
public interface ValidatorStateSource {

    /**
     * @return the observations of this cycle, never {@code null}
     */
    List<ValidatorObservation> fetchObservations();
}
