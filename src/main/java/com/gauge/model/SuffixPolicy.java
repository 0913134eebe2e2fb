package com.gauge.model;

/**
 * What the allocator appends after the zero-padded sequence number.
 */
public enum SuffixPolicy {
    NONE(""),
    GO("A"),
    NO_GO("B");

    private final String suffix;

    SuffixPolicy(String suffix) {
        this.suffix = suffix;
    }

    public String suffix() {
        return suffix;
    }
}
