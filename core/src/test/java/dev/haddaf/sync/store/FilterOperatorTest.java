package dev.haddaf.sync.store;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class FilterOperatorTest {

    @Test
    void comparesValuesOfTheSameKind() {
        assertThat(FilterOperator.LESS_THAN.matches("alpha", "beta")).isTrue();
        assertThat(FilterOperator.GREATER_THAN_OR_EQUAL.matches(Instant.parse("2025-06-02T00:00:00Z"),
            Instant.parse("2025-06-01T00:00:00Z"))).isTrue();
        assertThat(FilterOperator.compare("beta", "alpha")).isPositive();
    }

    @Test
    void comparesNumbersAcrossTypes() {
        assertThat(FilterOperator.LESS_THAN_OR_EQUAL.matches(3L, 3.0d)).isTrue();
        assertThat(FilterOperator.EQUAL.matches(2, 2L)).isTrue();
    }

    @Test
    void differentKindsAndMissingValuesNeverMatch() {
        assertThat(FilterOperator.compare("10", 10L)).isNull();
        assertThat(FilterOperator.GREATER_THAN.matches("2025", Instant.parse("2025-01-01T00:00:00Z"))).isFalse();
        assertThat(FilterOperator.LESS_THAN.matches(null, 5L)).isFalse();
    }
}
