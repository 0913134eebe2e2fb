package com.gauge.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of transitions recorded in the history ledger.
 */
public enum LifecycleAction {

    CREATED("created", HistoryPayload.Created.class),
    PAIRED_FROM_SPARES("paired_from_spares", HistoryPayload.Paired.class),
    REPLACED("replaced", HistoryPayload.Replaced.class),
    UNPAIRED("unpaired", HistoryPayload.Unpaired.class),
    RETIRED("retired", HistoryPayload.Retired.class),
    CASCADED_OUT_OF_SERVICE("cascaded_oos", HistoryPayload.StatusCascaded.class),
    CASCADED_RETURN_TO_SERVICE("cascaded_return", HistoryPayload.StatusCascaded.class),
    CASCADED_LOCATION("cascaded_location", HistoryPayload.Relocated.class);

    private final String code;
    private final Class<? extends HistoryPayload> payloadType;

    LifecycleAction(String code, Class<? extends HistoryPayload> payloadType) {
        this.code = code;
        this.payloadType = payloadType;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public Class<? extends HistoryPayload> payloadType() {
        return payloadType;
    }
}
