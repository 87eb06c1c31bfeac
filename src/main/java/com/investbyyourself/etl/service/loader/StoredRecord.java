package com.investbyyourself.etl.service.loader;

import com.investbyyourself.etl.model.TransformedRecord;

/**
 * A record as a backend currently holds it. {@code rowId} is backend-specific and only
 * needs to be unique within the scope.
 */
public record StoredRecord(String rowId, String checksum, TransformedRecord record) {

    public String recordKey() {
        return record.recordKey();
    }
}
