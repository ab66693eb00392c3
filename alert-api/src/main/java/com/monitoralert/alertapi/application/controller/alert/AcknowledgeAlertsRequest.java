package com.monitoralert.alertapi.application.controller.alert;

import jakarta.validation.constraints.NotEmpty;
import java.util.List;

public record AcknowledgeAlertsRequest(@NotEmpty(message = "At least one alert id is required") List<String> alerts) {}
