package com.gauge.dto;

/**
 * Derived status of a set, computed on read and never stored.
 */
public record CompositeStatus(String status, boolean canCheckout, String reason) {}
