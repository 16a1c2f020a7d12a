package com.wickscan.execution.position;

public enum PositionStatus {
    ACTIVE,
    CLOSED
}
