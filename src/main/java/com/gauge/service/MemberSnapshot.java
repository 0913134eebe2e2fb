package com.gauge.service;

import com.gauge.model.Gauge;

/**
 * Member references of a set captured at the moment a ledger entry is written,
 * before any detach clears the external ids.
 */
public record MemberSnapshot(Long goGaugeId, String goExternalId, Long noGoGaugeId, String noGoExternalId) {

    public static MemberSnapshot of(Gauge go, Gauge noGo) {
        return new MemberSnapshot(
            go != null ? go.getId() : null,
            go != null ? go.getExternalId() : null,
            noGo != null ? noGo.getId() : null,
            noGo != null ? noGo.getExternalId() : null);
    }
}
