package com.monitoralert.evaluator.domain.ledger;

import com.monitoralert.common.model.ActionExecutionResult;
import com.monitoralert.common.model.AlertHistoryEntry;
import java.util.List;
import java.util.Map;

/**
 * @param results  the alert's action execution results after this cycle
 * @param failures one history entry per action that ran and failed
 * @param notified whether at least one action ran successfully
 */
public record LedgerUpdate(
        Map<String, ActionExecutionResult> results, List<AlertHistoryEntry> failures, boolean notified) {}
