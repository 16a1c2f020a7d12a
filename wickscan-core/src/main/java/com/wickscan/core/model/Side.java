package com.wickscan.core.model;

/**
 * Position direction.
 */
public enum Side {
    LONG(1),
    SHORT(-1);

    private final int sign;

    Side(int sign) {
        this.sign = sign;
    }

    /**
     * +1 for long, -1 for short. Multiplying a price move by the sign yields the favorable move.
     */
    public int sign() {
        return sign;
    }

    public Side opposite() {
        return this == LONG ? SHORT : LONG;
    }
}
