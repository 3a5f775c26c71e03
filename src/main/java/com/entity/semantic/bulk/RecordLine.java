package com.entity.semantic.bulk;

import com.entity.semantic.core.model.SourceRecord;

/**
 * One parsed input line: a record, or the reason it could not be read.
 *
 * @param lineNumber 1-based line number
 * @param record     the record, null if unreadable
 * @param error      the parse error, null if readable
 */
public record RecordLine(long lineNumber, SourceRecord record, String error) {

    public boolean isValid() {
        return record != null;
    }
}
