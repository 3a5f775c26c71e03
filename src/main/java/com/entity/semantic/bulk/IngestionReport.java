package com.entity.semantic.bulk;

import java.util.List;

/**
 * Result of a bulk load.
 *
 * @param totalRecords  readable records in the input
 * @param indexed       records stored in the index
 * @param skipped       records without a canonical name
 * @param failed        records that ended with an error status
 * @param invalidLines  lines that could not be parsed into a record
 * @param errors        per-line errors, for failed records and invalid lines
 */
public record IngestionReport(
        long totalRecords,
        long indexed,
        long skipped,
        long failed,
        long invalidLines,
        List<LineError> errors
) {
    public IngestionReport {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * An error tied to an input line.
     *
     * @param lineNumber the line number in the input (1-based)
     * @param identifier the record identifier, empty if the line was unreadable
     * @param message    the error message
     */
    public record LineError(long lineNumber, String identifier, String message) {}

    @Override
    public String toString() {
        return "IngestionReport{total=" + totalRecords +
                ", indexed=" + indexed +
                ", skipped=" + skipped +
                ", failed=" + failed +
                ", invalid=" + invalidLines +
                ", errors=" + errors.size() + '}';
    }
}
