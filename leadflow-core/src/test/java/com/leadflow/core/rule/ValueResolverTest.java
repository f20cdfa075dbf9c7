package com.leadflow.core.rule;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadflow.core.model.RelativeTime;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ValueResolverTest {

    private static final Instant NOW = Instant.parse("2024-03-15T12:00:00Z");

    private final ValueResolver resolver = new ValueResolver();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void normalize_shouldTurnNumbersIntoDecimals() {
        assertThat(resolver.normalize(75)).isEqualTo(BigDecimal.valueOf(75));
        assertThat(resolver.normalize(75L)).isEqualTo(BigDecimal.valueOf(75));
        assertThat(resolver.valuesEqual(resolver.normalize(75), resolver.normalize(75.0))).isTrue();
        assertThat(resolver.normalize(Double.NaN)).isNull();
    }

    @Test
    void normalize_shouldTurnTemporalsIntoInstants() {
        Instant expected = Instant.parse("2024-03-01T00:00:00Z");
        
        assertThat(resolver.normalize(OffsetDateTime.of(2024, 3, 1, 0, 0, 0, 0, ZoneOffset.UTC))).isEqualTo(expected);
        assertThat(resolver.normalize(LocalDate.of(2024, 3, 1))).isEqualTo(expected);
        assertThat(resolver.normalize(Date.from(expected))).isEqualTo(expected);
    }

    @Test
    void normalize_shouldUnwrapJson() throws Exception {
        var node = mapper.readTree("{\"score\": 80, \"tags\": [\"vip\", \"demo_requested\"], \"opted_in\": true}");
        
        assertThat(resolver.normalize(node.get("score"))).isEqualTo(new BigDecimal("80"));
        assertThat(resolver.normalize(node.get("tags"))).isEqualTo(List.of("vip", "demo_requested"));
        assertThat(resolver.normalize(node.get("opted_in"))).isEqualTo(true);
        assertThat(resolver.normalize(node.get("missing"))).isNull();
    }

    @Test
    void normalize_shouldTurnSetsIntoLists() {
        Object normalized = resolver.normalize(Set.of(3));
        
        assertThat(normalized).isEqualTo(List.of(BigDecimal.valueOf(3)));
    }

    @Test
    void resolveExpected_shouldResolveRelativeTimeFreshEachCall() {
        RelativeTime sevenDays = RelativeTime.daysAgo(7);
        
        assertThat(resolver.resolveExpected(sevenDays, NOW)).isEqualTo(Instant.parse("2024-03-08T12:00:00Z"));
        assertThat(resolver.resolveExpected(sevenDays, NOW.plusSeconds(3600)))
            .isEqualTo(Instant.parse("2024-03-08T13:00:00Z"));
    }

    @Test
    void compare_shouldOnlyOrderLikeValues() {
        assertThat(resolver.compare(BigDecimal.ONE, BigDecimal.TEN)).isNegative();
        assertThat(resolver.compare(NOW, "2024-01-01T00:00:00Z")).isPositive();
        assertThat(resolver.compare(NOW, "2024-03-15")).isPositive();
        assertThat(resolver.compare("abc", BigDecimal.ONE)).isNull();
        assertThat(resolver.compare(NOW, BigDecimal.ONE)).isNull();
        assertThat(resolver.compare(null, BigDecimal.ONE)).isNull();
    }

    @Test
    void toInstant_shouldParseIsoForms() {
        assertThat(ValueResolver.toInstant("2024-03-15T12:00:00Z")).isEqualTo(NOW);
        assertThat(ValueResolver.toInstant("2024-03-15T14:00:00+02:00")).isEqualTo(NOW);
        assertThat(ValueResolver.toInstant("2024-03-15T12:00:00")).isEqualTo(NOW);
        assertThat(ValueResolver.toInstant("2024-03-15")).isEqualTo(Instant.parse("2024-03-15T00:00:00Z"));
        assertThat(ValueResolver.toInstant("next tuesday")).isNull();
        assertThat(ValueResolver.toInstant(42)).isNull();
    }
}
