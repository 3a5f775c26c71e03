package com.entity.semantic.bulk;

import java.util.Comparator;
import java.util.List;

/**
 * Latency summary of a bulk search run. Percentiles use the nearest-rank method.
 *
 * @param count                 timed requests
 * @param minMs                 fastest request
 * @param maxMs                 slowest request
 * @param avgMs                 mean latency
 * @param p90Ms                 90th percentile
 * @param p95Ms                 95th percentile
 * @param p99Ms                 99th percentile
 * @param percentUnderOneSecond share of requests that took at most one second, 0-100
 * @param slowestRequestId      request id of the slowest request, null if none
 */
public record LatencyStats(long count, double minMs, double maxMs, double avgMs,
                           double p90Ms, double p95Ms, double p99Ms,
                           double percentUnderOneSecond, String slowestRequestId) {

    private static final long ONE_SECOND_NANOS = 1_000_000_000L;

    /**
     * Wall-clock time of one request.
     */
    public record Timing(String requestId, long nanos) {}

    public static LatencyStats empty() {
        return new LatencyStats(0, 0, 0, 0, 0, 0, 0, 0, null);
    }

    public static LatencyStats of(List<Timing> timings) {
        if (timings.isEmpty()) {
            return empty();
        }
        List<Timing> sorted = timings.stream()
                .sorted(Comparator.comparingLong(Timing::nanos))
                .toList();
        int n = sorted.size();
        long total = 0;
        long underOneSecond = 0;
        for (Timing t : sorted) {
            total += t.nanos();
            if (t.nanos() <= ONE_SECOND_NANOS) {
                underOneSecond++;
            }
        }
        Timing slowest = sorted.get(n - 1);
        return new LatencyStats(n,
                millis(sorted.get(0).nanos()),
                millis(slowest.nanos()),
                millis(total) / n,
                millis(percentile(sorted, 0.90)),
                millis(percentile(sorted, 0.95)),
                millis(percentile(sorted, 0.99)),
                underOneSecond * 100.0 / n,
                slowest.requestId());
    }

    private static long percentile(List<Timing> sorted, double q) {
        int rank = (int) Math.ceil(q * sorted.size());
        return sorted.get(Math.max(0, rank - 1)).nanos();
    }

    private static double millis(long nanos) {
        return nanos / 1_000_000.0;
    }

    @Override
    public String toString() {
        return String.format("LatencyStats{count=%d, avg=%.3fms, min=%.3fms, max=%.3fms, p90=%.3fms, "
                        + "p95=%.3fms, p99=%.3fms, underOneSecond=%.1f%%, slowest=%s}",
                count, avgMs, minMs, maxMs, p90Ms, p95Ms, p99Ms, percentUnderOneSecond, slowestRequestId);
    }
}
