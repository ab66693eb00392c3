package com.monitoralert.alertapi.infrastructure.db.monitor.mapper;

import com.monitoralert.alertapi.infrastructure.db.monitor.MonitorEntity;
import com.monitoralert.common.document.MonitorDocumentParser;
import com.monitoralert.common.document.MonitorDocumentWriter;
import com.monitoralert.common.model.Monitor;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Maps between the monitor and its stored document. Hand-written because the document
 * goes through the shared parser and writer.
 */
@Component
@RequiredArgsConstructor
public class MonitorEntityMapper {

    private final MonitorDocumentParser parser;
    private final MonitorDocumentWriter writer;

    public Monitor toDomain(MonitorEntity entity) {
        return parser.parseMonitor(entity.getDocument()).toBuilder()
                .id(entity.getId())
                .version(entity.getVersion() == null ? 0L : entity.getVersion())
                .enabled(entity.isEnabled())
                .build();
    }

    public MonitorEntity toEntity(Monitor monitor, Instant now) {
        return MonitorEntity.builder()
                .id(monitor.id())
                .name(monitor.name())
                .enabled(monitor.enabled())
                .document(writer.toJson(monitor))
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public void updateEntity(Monitor monitor, MonitorEntity entity, Instant now) {
        entity.setName(monitor.name());
        entity.setEnabled(monitor.enabled());
        entity.setDocument(writer.toJson(monitor));
        entity.setUpdatedAt(now);
    }
}
