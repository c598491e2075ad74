/**
 * Read-time views over stored change events.
 *
 * <p>
 * {@link com.validatorsentinel.core.aggregation.EventAggregator} collapses
 * overlapping events into one severity-ranked record per key;
 * {@link com.validatorsentinel.core.aggregation.RugStatistics} derives the
 * per-epoch rug counts and feeds. Nothing in this package writes to storage.
 * </p>
 *
 * @since 1.0.0
 */
package com.validatorsentinel.core.aggregation;
