package com.entity.semantic.bulk;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LatencyStats Tests")
class LatencyStatsTest {

    private static long ms(long millis) {
        return millis * 1_000_000L;
    }

    @Test
    @DisplayName("Should compute nearest-rank percentiles over 1..100 ms")
    void percentiles() {
        List<LatencyStats.Timing> timings = new ArrayList<>();
        for (int i = 1; i <= 100; i++) {
            timings.add(new LatencyStats.Timing("r" + i, ms(i)));
        }
        Collections.shuffle(timings);

        LatencyStats stats = LatencyStats.of(timings);

        assertEquals(100, stats.count());
        assertEquals(1.0, stats.minMs(), 1e-9);
        assertEquals(100.0, stats.maxMs(), 1e-9);
        assertEquals(50.5, stats.avgMs(), 1e-9);
        assertEquals(90.0, stats.p90Ms(), 1e-9);
        assertEquals(95.0, stats.p95Ms(), 1e-9);
        assertEquals(99.0, stats.p99Ms(), 1e-9);
        assertEquals("r100", stats.slowestRequestId());
    }

    @Test
    @DisplayName("Share under one second should include exactly one second")
    void underOneSecond() {
        LatencyStats stats = LatencyStats.of(List.of(
                new LatencyStats.Timing("fast", ms(20)),
                new LatencyStats.Timing("edge", ms(1000)),
                new LatencyStats.Timing("slow", ms(1500)),
                new LatencyStats.Timing("slower", ms(2500))));

        assertEquals(50.0, stats.percentUnderOneSecond(), 1e-9);
        assertEquals("slower", stats.slowestRequestId());
    }

    @Test
    @DisplayName("Single timing should fill every percentile")
    void singleTiming() {
        LatencyStats stats = LatencyStats.of(List.of(new LatencyStats.Timing("only", ms(7))));

        assertEquals(7.0, stats.p90Ms(), 1e-9);
        assertEquals(7.0, stats.p99Ms(), 1e-9);
        assertEquals(100.0, stats.percentUnderOneSecond(), 1e-9);
    }

    @Test
    @DisplayName("No timings should give empty stats")
    void empty() {
        LatencyStats stats = LatencyStats.of(List.of());
        assertEquals(0, stats.count());
        assertNull(stats.slowestRequestId());
    }
}
