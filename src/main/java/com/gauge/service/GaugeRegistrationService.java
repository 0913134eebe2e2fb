package com.gauge.service;

import com.gauge.config.LifecycleProperties;
import com.gauge.dto.GaugeRegistrationRequest;
import com.gauge.dto.GaugeResponse;
import com.gauge.exception.GaugeValidationException;
import com.gauge.exception.NonPairableCategoryException;
import com.gauge.model.EquipmentClass;
import com.gauge.model.Gauge;
import com.gauge.model.GaugeCategory;
import com.gauge.model.OwnershipType;
import com.gauge.repository.GaugeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Brings new gauges into the system.
 *
 * - Thread gauges of a pairable category enter as spares without an external id
 * - Everything else gets an external id from the (category, sub-type) sequence
 *
 * Serial numbers of thread gauges are checked for uniqueness while the category's
 * sequence row is locked, so two concurrent registrations cannot both pass.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GaugeRegistrationService {

    private final LifecycleTransactions transactions;
    private final GaugeRecordStore recordStore;
    private final IdentifierAllocator allocator;
    private final IdentifierGuard identifierGuard;
    private final GaugeRepository gaugeRepository;
    private final LifecycleProperties properties;

    public GaugeResponse registerSpare(GaugeRegistrationRequest request) {
        Gauge saved = transactions.write("registerSpare", () -> {
            GaugeCategory category = recordStore.category(request.getCategoryId());
            if (!category.getEquipmentClass().isPairable() || category.isNonPairable()) {
                throw new NonPairableCategoryException(
                    category.getName() + " gauges cannot be registered as spares",
                    "categoryId", "a pairable category", category.getName());
            }

            allocator.lock(category.getId(), properties.setSequenceSubType());
            String serialNumber = requireUniqueSerial(request.getSerialNumber());

            Gauge gauge = newGauge(request, category, serialNumber);
            gauge.setSpare(true);
            return gaugeRepository.save(gauge);
        });

        log.info("Registered spare {} (serial {}) in category {}", saved.getId(), saved.getSerialNumber(), saved.getCategoryId());
        return GaugeResponse.from(saved);
    }

    /**
     * Register a gauge that will never be paired: hand tools, large equipment,
     * calibration standards and thread gauges of a non-pairable category such as NPT.
     */
    public GaugeResponse registerGauge(GaugeRegistrationRequest request) {
        Gauge saved = transactions.write("registerGauge", () -> {
            GaugeCategory category = recordStore.category(request.getCategoryId());
            if (category.getEquipmentClass().isPairable() && !category.isNonPairable()) {
                throw new GaugeValidationException("PAIRABLE_CATEGORY",
                    category.getName() + " gauges are registered as spares or as sets",
                    "categoryId", "a non-pairable category", category.getName());
            }

            String externalId = identifierGuard.issue(category.getId(), request.getSubType());
            String serialNumber = category.getEquipmentClass() == EquipmentClass.THREAD_GAUGE
                ? requireUniqueSerial(request.getSerialNumber())
                : trimToNull(request.getSerialNumber());

            Gauge gauge = newGauge(request, category, serialNumber);
            gauge.setExternalId(externalId);
            gauge.setSpare(false);
            return gaugeRepository.save(gauge);
        });

        log.info("Registered gauge {} as {} in category {}", saved.getId(), saved.getExternalId(), saved.getCategoryId());
        return GaugeResponse.from(saved);
    }

    private String requireUniqueSerial(String serialNumber) {
        String trimmed = trimToNull(serialNumber);
        if (trimmed == null) {
            throw new GaugeValidationException("SERIAL_NUMBER_REQUIRED",
                "Thread gauges require a serial number", "serialNumber", "a serial number", serialNumber);
        }
        if (gaugeRepository.existsThreadGaugeWithSerialNumber(trimmed)) {
            throw new GaugeValidationException("DUPLICATE_SERIAL_NUMBER",
                "A thread gauge with serial number " + trimmed + " already exists",
                "serialNumber", "a unique serial number", trimmed);
        }
        return trimmed;
    }

    private static Gauge newGauge(GaugeRegistrationRequest request, GaugeCategory category, String serialNumber) {
        return Gauge.builder()
            .serialNumber(serialNumber)
            .equipmentClass(category.getEquipmentClass())
            .categoryId(category.getId())
            .specFingerprint(request.getSpec())
            .sealed(request.isSealed())
            .ownershipType(request.getOwnershipType() != null ? request.getOwnershipType() : OwnershipType.COMPANY)
            .ownerRef(request.getOwnerRef())
            .build();
    }

    private static String trimToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
