package com.gauge.model;

import java.time.Instant;

/**
 * Structured metadata recorded with a ledger entry. One record type per
 * {@link LifecycleAction}; stored as JSON in the metadata column.
 */
public interface HistoryPayload {

    String setId();

    record Created(String setId, Long goGaugeId, Long noGoGaugeId, Long categoryId, String specification)
        implements HistoryPayload {}

    record Paired(String setId, Long goGaugeId, Long noGoGaugeId, String location, boolean customIdentifier)
        implements HistoryPayload {}

    record Replaced(String setId, Long oldMemberId, Long newMemberId, Long companionId, GaugeSuffix suffix)
        implements HistoryPayload {}

    record Unpaired(String setId, Long goGaugeId, Long noGoGaugeId)
        implements HistoryPayload {}

    record Retired(String setId, Long goGaugeId, Long noGoGaugeId, Instant retiredAt)
        implements HistoryPayload {}

    record StatusCascaded(String setId, Long initiatedBy, Long companionId, GaugeStatus newStatus)
        implements HistoryPayload {}

    record Relocated(String setId, String location)
        implements HistoryPayload {}
}
