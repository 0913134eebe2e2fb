package com.gauge.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Pair two spares into a new set.
 *
 * customSetId is optional; when absent the next identifier of the category's set
 * sequence is allocated.
 */
@AllArgsConstructor
@NoArgsConstructor
@Builder
@Data
public class PairSparesRequest {

    @NotNull(message = "goGaugeId is required")
    private Long goGaugeId;

    @NotNull(message = "noGoGaugeId is required")
    private Long noGoGaugeId;

    private String location;
    private String reason;
    private String customSetId;
}
