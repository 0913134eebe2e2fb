package com.gauge.dto;

import com.gauge.model.GaugeStatus;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Out-of-service or return-to-service request; cascades to the companion.
 */
@AllArgsConstructor
@NoArgsConstructor
@Builder
@Data
public class StatusChangeRequest {

    @NotNull(message = "status is required")
    private GaugeStatus status;

    private String reason;
}
