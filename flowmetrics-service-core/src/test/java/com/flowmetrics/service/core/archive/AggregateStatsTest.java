package com.flowmetrics.service.core.archive;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class AggregateStatsTest {

    @Test
    void mergeIsEquivalentToAccumulatingAllValues() {
        AggregateStats left = AggregateStats.of(2.0, 4.0);
        AggregateStats right = AggregateStats.of(4.0, 4.0, 5.0, 5.0, 7.0, 9.0);

        AggregateStats merged = left.merge(right);

        assertThat(merged).isEqualTo(AggregateStats.of(2.0, 4.0, 4.0, 4.0, 5.0, 5.0, 7.0, 9.0));
        assertThat(merged.mean()).isEqualTo(5.0);
        assertThat(merged.stddev()).isCloseTo(2.0, within(1e-9));
        assertThat(merged.minOrNull()).isEqualTo(2.0);
        assertThat(merged.maxOrNull()).isEqualTo(9.0);
    }

    @Test
    void emptyStatsHaveNoMeanAndAreMergeIdentity() {
        AggregateStats stats = AggregateStats.of(3.0);

        assertThat(AggregateStats.EMPTY.mean()).isNull();
        assertThat(AggregateStats.EMPTY.variance()).isNull();
        assertThat(AggregateStats.EMPTY.merge(stats)).isEqualTo(stats);
        assertThat(stats.merge(AggregateStats.EMPTY)).isEqualTo(stats);
        assertThat(stats.merge(null)).isEqualTo(stats);
    }

    @Test
    void varianceIsNeverNegative() {
        AggregateStats constant = AggregateStats.of(0.1, 0.1, 0.1);

        assertThat(constant.variance()).isGreaterThanOrEqualTo(0.0);
    }

    @Test
    void payloadCodecRestoresStats() {
        AggregateStats stats = AggregateStats.of(120.0, 80.5, 310.0);

        byte[] payload = ArchivePayloadCodec.serialize(stats);

        assertThat(payload).isNotEmpty();
        assertThat(ArchivePayloadCodec.deserialize(payload)).isEqualTo(stats);
        assertThat(ArchivePayloadCodec.deserialize(new byte[0])).isEqualTo(AggregateStats.EMPTY);
    }

    @Test
    void levelsAlignToUtcBoundaries() {
        Instant at = Instant.parse("2024-05-06T13:47:12.345Z");

        assertThat(AggregationLevel.HOURLY.align(at)).isEqualTo(Instant.parse("2024-05-06T13:00:00Z"));
        assertThat(AggregationLevel.DAILY.align(at)).isEqualTo(Instant.parse("2024-05-06T00:00:00Z"));
        assertThat(AggregationLevel.fromString("Daily")).isEqualTo(AggregationLevel.DAILY);
    }
}
