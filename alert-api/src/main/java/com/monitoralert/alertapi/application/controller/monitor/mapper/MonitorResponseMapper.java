package com.monitoralert.alertapi.application.controller.monitor.mapper;

import com.monitoralert.alertapi.application.controller.monitor.MonitorResponse;
import com.monitoralert.common.document.MonitorDocumentWriter;
import com.monitoralert.common.model.Monitor;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class MonitorResponseMapper {

    private final MonitorDocumentWriter writer;

    public MonitorResponse toResponse(Monitor monitor) {
        return new MonitorResponse(monitor.id(), monitor.version(), writer.toDocument(monitor));
    }
}
