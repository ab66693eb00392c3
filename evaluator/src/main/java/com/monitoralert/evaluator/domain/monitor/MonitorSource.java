package com.monitoralert.evaluator.domain.monitor;

import com.monitoralert.common.model.Monitor;
import java.util.List;

public interface MonitorSource {

    List<Monitor> findEnabledMonitors();
}
