package com.gauge.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.gauge.model.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GaugeResponse {

    private Long id;
    private String externalId;
    private String serialNumber;
    private String setId;
    private GaugeSuffix suffix;
    private Long companionId;
    private EquipmentClass equipmentClass;
    private Long categoryId;
    private SpecFingerprint spec;
    private GaugeStatus status;
    private boolean sealed;
    private OwnershipType ownershipType;
    private String ownerRef;
    private boolean spare;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant deletedAt;

    public static GaugeResponse from(Gauge gauge) {
        return GaugeResponse.builder()
            .id(gauge.getId())
            .externalId(gauge.getExternalId())
            .serialNumber(gauge.getSerialNumber())
            .setId(gauge.getSetId())
            .suffix(gauge.getSuffix())
            .companionId(gauge.getCompanionId())
            .equipmentClass(gauge.getEquipmentClass())
            .categoryId(gauge.getCategoryId())
            .spec(gauge.getSpecFingerprint())
            .status(gauge.getStatus())
            .sealed(gauge.isSealed())
            .ownershipType(gauge.getOwnershipType())
            .ownerRef(gauge.getOwnerRef())
            .spare(gauge.isSpare())
            .deletedAt(gauge.getDeletedAt())
            .build();
    }
}
