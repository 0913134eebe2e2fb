package com.gauge.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body for unpair and retire. Retirement rejects a blank reason.
 */
@AllArgsConstructor
@NoArgsConstructor
@Builder
@Data
public class ReasonRequest {

    private String reason;
}
