package com.entity.semantic.bulk;

import java.util.List;

/**
 * Result of a bulk search run.
 *
 * @param totalRequests   readable search records in the input
 * @param merged          searches that reached the index and merged its hits
 * @param skipped         search records without a canonical name
 * @param failed          searches that ended with an error status
 * @param invalidLines    lines that could not be parsed into a record
 * @param totalCandidates candidates returned over all searches
 * @param truncated       searches whose index traversal hit the deadline
 * @param latency         per-request latency summary
 * @param errors          per-line errors
 */
public record SearchReport(
        long totalRequests,
        long merged,
        long skipped,
        long failed,
        long invalidLines,
        long totalCandidates,
        long truncated,
        LatencyStats latency,
        List<IngestionReport.LineError> errors
) {
    public SearchReport {
        errors = errors != null ? List.copyOf(errors) : List.of();
        latency = latency != null ? latency : LatencyStats.empty();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    @Override
    public String toString() {
        return "SearchReport{total=" + totalRequests +
                ", merged=" + merged +
                ", skipped=" + skipped +
                ", failed=" + failed +
                ", invalid=" + invalidLines +
                ", candidates=" + totalCandidates +
                ", truncated=" + truncated +
                ", latency=" + latency + '}';
    }
}
