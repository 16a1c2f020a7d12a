package com.wickscan.execution.open;

public enum OpenStatus {
    OPENED,
    CAPACITY,
    ALREADY_RESERVED,
    NO_TOUCH,
    DATA_UNAVAILABLE,
    EXCHANGE_ERROR,
    FAILED
}
