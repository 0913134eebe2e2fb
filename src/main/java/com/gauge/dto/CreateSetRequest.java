package com.gauge.dto;

import com.gauge.model.OwnershipType;
import com.gauge.model.SpecFingerprint;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Register two new thread gauges directly as a set.
 */
@AllArgsConstructor
@NoArgsConstructor
@Builder
@Data
public class CreateSetRequest {

    @NotNull(message = "categoryId is required")
    private Long categoryId;

    @NotNull(message = "spec is required")
    private SpecFingerprint spec;

    @NotBlank(message = "goSerialNumber is required")
    private String goSerialNumber;

    @NotBlank(message = "noGoSerialNumber is required")
    private String noGoSerialNumber;

    private OwnershipType ownershipType;
    private String ownerRef;
    private String customSetId;
    private String location;
    private String reason;
}
