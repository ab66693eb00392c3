package com.monitoralert.common.persistence;

import com.monitoralert.common.document.MonitorDocumentParser;
import com.monitoralert.common.document.MonitorDocumentWriter;
import com.monitoralert.common.id.IdGenerator;
import com.monitoralert.common.model.AlertHistoryEntry;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.util.List;

@Converter
public class AlertHistoryConverter implements AttributeConverter<List<AlertHistoryEntry>, String> {

    private final MonitorDocumentParser parser = new MonitorDocumentParser(IdGenerator.ULID);
    private final MonitorDocumentWriter writer = new MonitorDocumentWriter();

    @Override
    public String convertToDatabaseColumn(List<AlertHistoryEntry> history) {
        return writer.alertHistoryToJson(history == null ? List.of() : history);
    }

    @Override
    public List<AlertHistoryEntry> convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        return parser.parseAlertHistory(json);
    }
}
