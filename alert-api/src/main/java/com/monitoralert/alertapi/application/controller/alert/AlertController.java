package com.monitoralert.alertapi.application.controller.alert;

import com.monitoralert.alertapi.application.controller.alert.mapper.AlertResponseMapper;
import com.monitoralert.alertapi.application.service.AlertCommandHandler;
import com.monitoralert.common.model.AlertState;
import com.monitoralert.common.transport.AcknowledgeAlertRequest;
import com.monitoralert.common.transport.RefreshPolicy;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/monitors/{monitorId}")
@RequiredArgsConstructor
public class AlertController {

    private final AlertCommandHandler commandHandler;
    private final AlertResponseMapper mapper;

    @GetMapping("/alerts")
    public List<AlertResponse> listAlerts(
            @PathVariable String monitorId, @RequestParam(required = false) AlertState state) {
        return commandHandler.listAlerts(monitorId, state).stream()
                .map(mapper::toResponse)
                .toList();
    }

    @PostMapping("/_acknowledge/alerts")
    public AcknowledgeAlertResponse acknowledge(
            @PathVariable String monitorId,
            @RequestParam(required = false) String refresh,
            @Valid @RequestBody AcknowledgeAlertsRequest request) {
        var outcome = commandHandler.acknowledge(
                new AcknowledgeAlertRequest(monitorId, request.alerts(), RefreshPolicy.parse(refresh)));
        return mapper.toResponse(outcome);
    }
}
