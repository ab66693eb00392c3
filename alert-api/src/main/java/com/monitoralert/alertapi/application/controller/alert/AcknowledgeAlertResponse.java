package com.monitoralert.alertapi.application.controller.alert;

import java.util.List;

public record AcknowledgeAlertResponse(List<String> success, List<String> failed) {}
