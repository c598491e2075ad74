package com.validatorsentinel.core.detection;

import com.validatorsentinel.core.config.ThresholdsConfig;
import com.validatorsentinel.core.model.AttributeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Factory that creates {@link SeverityRule} instances from
 * {@link ThresholdsConfig}.
 *
 * <p>
 * This is the single point of extension when a new attribute is tracked:
 * add the {@link AttributeKind} constant and map it to its rule here.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeverityRuleFactory {

    private static final Logger LOG = LoggerFactory.getLogger(SeverityRuleFactory.class);

    private SeverityRuleFactory() {
        // utility class, not instantiable
    }

    /**
     * Create the rule for one attribute.
     *
     * @param kind   the attribute; must not be {@code null}
     * @param config thresholds; must not be {@code null}
     * @return the rule for {@code kind}
     * @throws NullPointerException if an argument is {@code null}
     */
    public static SeverityRule create(AttributeKind kind, ThresholdsConfig config) {
        Objects.requireNonNull(kind, "AttributeKind must not be null");
        Objects.requireNonNull(config, "ThresholdsConfig must not be null");
        return switch (kind) {
            case COMMISSION -> new CommissionSeverityRule(config.forKind(kind));
            case MEV -> new MevSeverityRule(config.forKind(kind));
        };
    }

    /**
     * Create one rule per tracked attribute.
     *
     * @param config thresholds; must not be {@code null}
     * @return unmodifiable map of attribute to rule
     */
    public static Map<AttributeKind, SeverityRule> createAll(ThresholdsConfig config) {
        Objects.requireNonNull(config, "ThresholdsConfig must not be null");
        Map<AttributeKind, SeverityRule> rules = new EnumMap<>(AttributeKind.class);
        for (AttributeKind kind : AttributeKind.values()) {
            rules.put(kind, create(kind, config));
        }
        LOG.debug("Created {} severity rule(s)", rules.size());
        return Collections.unmodifiableMap(rules);
    }
}
