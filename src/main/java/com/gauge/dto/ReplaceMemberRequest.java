package com.gauge.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@AllArgsConstructor
@NoArgsConstructor
@Builder
@Data
public class ReplaceMemberRequest {

    @NotNull(message = "existingGaugeId is required")
    private Long existingGaugeId;

    @NotNull(message = "replacementGaugeId is required")
    private Long replacementGaugeId;

    @NotBlank(message = "reason is required")
    private String reason;
}
