package com.monitoralert.common.model;

public enum AlertState {
    ACTIVE,
    ACKNOWLEDGED,
    COMPLETED,
    ERROR,
    DELETED
}
