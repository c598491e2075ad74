package com.validatorsentinel.core.aggregation;

/**
 * How {@link EventAggregator} folds a batch of change events.
 *
 * @since 1.0.0
 */
public enum AggregationMode {

    /** Every event, newest first. */
    ALL,

    /** One event per grouping key: the most severe, then the most recent. */
    MOST_SEVERE
}
