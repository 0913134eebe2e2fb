package com.gauge.model;

/**
 * Position of a gauge inside its set. A is the GO member, B the NO-GO member.
 */
public enum GaugeSuffix {
    A,
    B;

    public GaugeSuffix other() {
        return this == A ? B : A;
    }
}
