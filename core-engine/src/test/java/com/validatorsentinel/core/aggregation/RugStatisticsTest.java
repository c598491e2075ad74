package com.validatorsentinel.core.aggregation;

import com.validatorsentinel.core.model.AttributeKind;
import com.validatorsentinel.core.model.ChangeEvent;
import com.validatorsentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.validatorsentinel.core.aggregation.EventAggregatorTest.event;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link RugStatistics}.
 */
class RugStatisticsTest {

    @Test
    @DisplayName("Should count each rugged validator once per epoch")
    void countsDistinctValidators() {
        List<ChangeEvent> events = List.of(
                event("A", AttributeKind.COMMISSION, 10, Severity.RUG, 0, 5, 100),
                event("A", AttributeKind.MEV, 10, Severity.RUG, 10, 0, 100),
                event("B", AttributeKind.COMMISSION, 10, Severity.RUG, 20, 0, 95),
                event("C", AttributeKind.COMMISSION, 10, Severity.CAUTION, 30, 0, 20),
                event("A", AttributeKind.COMMISSION, 8, Severity.RUG, 40, 0, 100));

        Map<Long, Integer> perEpoch = RugStatistics.rugsPerEpoch(events);

        assertThat(perEpoch).containsExactly(Map.entry(8L, 1), Map.entry(10L, 2));
    }

    @Test
    @DisplayName("Should list the rugs of one epoch, fee before MEV")
    void listsRugsOfEpoch() {
        ChangeEvent bFee = event("B", AttributeKind.COMMISSION, 10, Severity.RUG, 0, 0, 95);
        ChangeEvent aMev = event("A", AttributeKind.MEV, 10, Severity.RUG, 10, 0, 100);
        ChangeEvent aFee = event("A", AttributeKind.COMMISSION, 10, Severity.RUG, 20, 5, 100);
        ChangeEvent otherEpoch = event("A", AttributeKind.COMMISSION, 11, Severity.RUG, 30, 0, 100);
        ChangeEvent caution = event("C", AttributeKind.COMMISSION, 10, Severity.CAUTION, 40, 0, 20);

        List<ChangeEvent> rugs = RugStatistics.rugsInEpoch(List.of(bFee, aMev, aFee, otherEpoch, caution), 10);

        assertThat(rugs).containsExactly(aFee, aMev, bFee);
    }

    @Test
    @DisplayName("Should keep the newest rug when a validator rugged twice in one epoch")
    void keepsNewestRug() {
        ChangeEvent first = event("A", AttributeKind.COMMISSION, 10, Severity.RUG, 0, 5, 95);
        ChangeEvent second = event("A", AttributeKind.COMMISSION, 10, Severity.RUG, 60, 0, 100);

        assertThat(RugStatistics.rugsInEpoch(List.of(first, second), 10)).containsExactly(second);
    }

    @Test
    @DisplayName("No rugs gives an empty view")
    void noRugs() {
        assertThat(RugStatistics.rugsPerEpoch(List.of())).isEmpty();
        assertThat(RugStatistics.rugsInEpoch(List.of(), 10)).isEmpty();
    }
}
