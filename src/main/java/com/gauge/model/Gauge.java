package com.gauge.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.Instant;
import java.util.Objects;

/**
 * One physical measurement item.
 *
 * Key design decisions:
 * - id is a surrogate key and the only thing lock ordering is based on
 * - companionId is a plain id, resolved by lookup; never an object reference
 * - setId survives retirement so history stays attributable
 * - externalId is unique when present; spares of a pairable class have none
 * - serialNumber uniqueness among thread gauges is checked on registration
 */
@Entity
@Table(name = "gauges",
    uniqueConstraints = @UniqueConstraint(name = "uq_gauge_external_id", columnNames = "externalId"),
    indexes = {
        @Index(name = "idx_gauge_set", columnList = "setId"),
        @Index(name = "idx_gauge_category_spare", columnList = "categoryId,spare")
    })
@EntityListeners(AuditingEntityListener.class)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Gauge {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 30)
    private String externalId;

    @Column(length = 100, updatable = false)
    private String serialNumber;

    @Column(length = 30)
    private String setId;

    @Enumerated(EnumType.STRING)
    @Column(length = 1)
    private GaugeSuffix suffix;

    private Long companionId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private EquipmentClass equipmentClass;

    @Column(nullable = false)
    private Long categoryId;

    @Embedded
    private SpecFingerprint specFingerprint;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private GaugeStatus status = GaugeStatus.AVAILABLE;

    @Builder.Default
    @Column(nullable = false)
    private boolean sealed = false;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private OwnershipType ownershipType = OwnershipType.COMPANY;

    /** Customer identity when ownershipType is CUSTOMER. */
    @Column(length = 100)
    private String ownerRef;

    @Column(nullable = false)
    private boolean spare;

    private Instant deletedAt;

    @CreatedDate
    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @LastModifiedDate
    @Column(nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    public boolean isDeleted() {
        return deletedAt != null;
    }

    public boolean isInSet() {
        return setId != null;
    }

    /** Same ownership type and, for customer gauges, the same customer. */
    public boolean sameOwnerAs(Gauge other) {
        return ownershipType == other.ownershipType
            && (ownershipType != OwnershipType.CUSTOMER || Objects.equals(ownerRef, other.ownerRef));
    }

    public String ownerDescription() {
        return ownershipType == OwnershipType.CUSTOMER ? "customer " + ownerRef : "company";
    }

    /** Serial number for thread gauges, external id otherwise. */
    public String itemRef() {
        return externalId != null ? externalId : serialNumber;
    }

    public void detachFromSet() {
        setId = null;
        companionId = null;
        suffix = null;
        externalId = null;
        spare = equipmentClass.isPairable();
    }

    public void attachToSet(String newSetId, GaugeSuffix newSuffix, Long newCompanionId) {
        setId = newSetId;
        suffix = newSuffix;
        companionId = newCompanionId;
        externalId = newSetId + newSuffix.name();
        spare = false;
    }
}
