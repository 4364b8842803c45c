package com.flashperp.core.model;

/**
 * Direction of a leveraged position.
 */
public enum Side {
    LONG,
    SHORT;

    public boolean isLong() {
        return this == LONG;
    }

    public boolean isShort() {
        return this == SHORT;
    }
}
