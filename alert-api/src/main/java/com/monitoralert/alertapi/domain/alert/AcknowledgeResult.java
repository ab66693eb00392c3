package com.monitoralert.alertapi.domain.alert;

import com.monitoralert.common.lifecycle.AcknowledgeOutcome;

/**
 * @param outcome per-id result reported to the caller
 * @param acknowledged alerts this request moved to ACKNOWLEDGED, across every attempt
 */
public record AcknowledgeResult(AcknowledgeOutcome outcome, int acknowledged) {}
