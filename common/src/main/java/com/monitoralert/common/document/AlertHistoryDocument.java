package com.monitoralert.common.document;

import static com.monitoralert.common.document.DocumentFields.required;

import com.monitoralert.common.model.AlertHistoryEntry;
import java.time.Instant;

public record AlertHistoryDocument(Long timestamp, String message) {

    static AlertHistoryDocument from(AlertHistoryEntry entry) {
        return new AlertHistoryDocument(entry.timestamp().toEpochMilli(), entry.message());
    }

    AlertHistoryEntry toEntry() {
        return new AlertHistoryEntry(
                Instant.ofEpochMilli(required(timestamp, "timestamp", "alert history entry")), message);
    }
}
