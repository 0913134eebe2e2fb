package com.gauge.service;

import com.gauge.dto.CompositeStatus;
import com.gauge.model.Gauge;
import com.gauge.model.GaugeStatus;
import com.gauge.model.SealState;

import java.util.List;

/**
 * Derives the status and seal state of a set from its two members.
 * Pure functions over snapshots; nothing here touches storage.
 */
public final class SetStatusAggregator {

    private record Rule(GaugeStatus trigger, String compositeStatus, String reason) {}

    /** Highest priority first. The first rule matching either member wins. */
    private static final List<Rule> PRIORITY = List.of(
        new Rule(GaugeStatus.CHECKED_OUT, "partially_checked_out", "One gauge in set is checked out"),
        new Rule(GaugeStatus.OUT_OF_SERVICE, "out_of_service", "One or both gauges are out of service"),
        new Rule(GaugeStatus.CALIBRATION_DUE, "calibration_due", "One or both gauges need calibration"),
        new Rule(GaugeStatus.OUT_FOR_CALIBRATION, "out_for_calibration", "One or both gauges are out for calibration"),
        new Rule(GaugeStatus.PENDING_QC, "pending_qc", "One or both gauges are pending QC"),
        new Rule(GaugeStatus.PENDING_CERTIFICATE, "pending_certificate", "One or both gauges are pending certificate"),
        new Rule(GaugeStatus.PENDING_RELEASE, "pending_release", "One or both gauges are pending release")
    );

    private SetStatusAggregator() {
    }

    public static CompositeStatus compositeStatus(Gauge go, Gauge noGo) {
        return compositeStatus(go.getStatus(), noGo.getStatus());
    }

    public static CompositeStatus compositeStatus(GaugeStatus go, GaugeStatus noGo) {
        if (go == GaugeStatus.AVAILABLE && noGo == GaugeStatus.AVAILABLE) {
            return new CompositeStatus(GaugeStatus.AVAILABLE.code(), true, "Both gauges available");
        }

        for (Rule rule : PRIORITY) {
            if (go == rule.trigger() || noGo == rule.trigger()) {
                return new CompositeStatus(rule.compositeStatus(), false, rule.reason());
            }
        }

        return new CompositeStatus(go.code(), false, "Both gauges have status: " + go.code());
    }

    public static SealState compositeSeal(Gauge go, Gauge noGo) {
        return compositeSeal(go.isSealed(), noGo.isSealed());
    }

    public static SealState compositeSeal(boolean goSealed, boolean noGoSealed) {
        return goSealed || noGoSealed ? SealState.SEALED : SealState.UNSEALED;
    }
}
