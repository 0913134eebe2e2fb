package com.gauge.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.gauge.model.HistoryPayload;
import com.gauge.model.LifecycleAction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HistoryEntryResponse {

    private Long id;
    private String identifier;
    private LifecycleAction action;
    private String actorRef;
    private String reason;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant occurredAt;

    private Long goGaugeId;
    private Long noGoGaugeId;
    private String goExternalId;
    private String noGoExternalId;
    private HistoryPayload metadata;
}
