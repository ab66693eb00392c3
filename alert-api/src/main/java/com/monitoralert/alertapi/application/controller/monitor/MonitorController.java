package com.monitoralert.alertapi.application.controller.monitor;

import com.monitoralert.alertapi.application.controller.monitor.mapper.MonitorResponseMapper;
import com.monitoralert.alertapi.application.service.MonitorCommandHandler;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Monitor documents are taken as raw JSON so the shared parser can reject unknown fields
 * and apply its defaults.
 */
@RestController
@RequestMapping("/api/v1/monitors")
@RequiredArgsConstructor
public class MonitorController {

    private final MonitorCommandHandler commandHandler;
    private final MonitorResponseMapper mapper;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<MonitorResponse> createMonitor(@RequestBody String document) {
        var monitor = commandHandler.createMonitor(document);
        return ResponseEntity.status(HttpStatus.CREATED).body(mapper.toResponse(monitor));
    }

    @GetMapping
    public List<MonitorResponse> listMonitors() {
        return commandHandler.listMonitors().stream().map(mapper::toResponse).toList();
    }

    @GetMapping("/{monitorId}")
    public MonitorResponse getMonitor(@PathVariable String monitorId) {
        return mapper.toResponse(commandHandler.getMonitor(monitorId));
    }

    @PutMapping(path = "/{monitorId}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public MonitorResponse updateMonitor(
            @PathVariable String monitorId,
            @RequestParam(required = false) Long version,
            @RequestBody String document) {
        return mapper.toResponse(commandHandler.updateMonitor(monitorId, document, version));
    }

    @DeleteMapping("/{monitorId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteMonitor(@PathVariable String monitorId) {
        commandHandler.deleteMonitor(monitorId);
    }
}
