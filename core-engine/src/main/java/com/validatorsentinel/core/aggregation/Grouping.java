package com.validatorsentinel.core.aggregation;

import com.validatorsentinel.core.model.ChangeEvent;

/**
 * Grouping key used by {@link AggregationMode#MOST_SEVERE}.
 *
 * @since 1.0.0
 */
public enum Grouping {

    /**
     * At most one row per validator over the whole window, for the live
     * "current risk" view. An earlier rug is hidden once a later event of equal
     * or higher severity exists for the same validator.
     */
    PER_ENTITY {
        @Override
        String keyOf(ChangeEvent event) {
            return event.getEntityId();
        }
    },

    /**
     * At most one row per validator, epoch and attribute, for the historical
     * per-epoch feed. Rugs in different epochs both survive.
     */
    PER_ENTITY_EPOCH_KIND {
        @Override
        String keyOf(ChangeEvent event) {
            return event.getEntityId() + '|' + event.getEpoch() + '|' + event.getAttribute();
        }
    };

    abstract String keyOf(ChangeEvent event);
}
