package com.wickscan.execution.position;

public enum ExitReason {
    STOP_LOSS,
    TAKE_PROFIT,
    TRAILING_STOP,
    FORCE_CLOSE
}
