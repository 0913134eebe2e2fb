package com.gauge.model;

public enum EquipmentClass {
    THREAD_GAUGE,
    HAND_TOOL,
    LARGE_EQUIPMENT,
    CALIBRATION_STANDARD;

    /** Only thread gauges come as GO/NO-GO pairs. */
    public boolean isPairable() {
        return this == THREAD_GAUGE;
    }
}
