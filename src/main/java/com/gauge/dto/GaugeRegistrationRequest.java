package com.gauge.dto;

import com.gauge.model.OwnershipType;
import com.gauge.model.SpecFingerprint;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Register one gauge.
 *
 * For a pairable category the gauge becomes a spare and serialNumber is mandatory.
 * Otherwise an external id is allocated from the (category, subType) sequence.
 */
@AllArgsConstructor
@NoArgsConstructor
@Builder
@Data
public class GaugeRegistrationRequest {

    @NotNull(message = "categoryId is required")
    private Long categoryId;

    private String serialNumber;
    private String subType;
    private SpecFingerprint spec;
    private OwnershipType ownershipType;
    private String ownerRef;
    private boolean sealed;
}
