package com.gauge.model;

public enum OwnershipType {
    COMPANY,
    CUSTOMER
}
