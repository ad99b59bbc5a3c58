package com.autotrader.model;

public enum PendingActionType {
    FULL_CLOSE,
    PARTIAL_CLOSE,
    SCALE_IN
}
