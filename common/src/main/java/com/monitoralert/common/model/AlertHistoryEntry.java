package com.monitoralert.common.model;

import java.time.Instant;

public record AlertHistoryEntry(Instant timestamp, String message) {}
