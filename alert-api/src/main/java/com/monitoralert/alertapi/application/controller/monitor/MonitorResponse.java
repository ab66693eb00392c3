package com.monitoralert.alertapi.application.controller.monitor;

import com.monitoralert.common.document.MonitorDocument;

public record MonitorResponse(String id, long version, MonitorDocument monitor) {}
