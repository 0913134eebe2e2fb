package com.gauge;

import com.gauge.model.*;
import com.gauge.repository.GaugeCategoryRepository;
import com.gauge.repository.GaugeRepository;
import com.gauge.repository.IdentifierSequenceRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.jdbc.JdbcTestUtils;

/**
 * Resets the database and creates gauges for integration tests.
 *
 * Categories:
 * - 1 Standard (thread, pairable, "set" sequence SP starting at 100)
 * - 2 Metric (thread, pairable, "set" sequence MT starting at 1)
 * - 4 NPT (thread, non-pairable, "default" sequence NPT)
 * - 7 Caliper (hand tool, "default" sequence CA)
 */
public class GaugeTestData {

    public static final long STANDARD = 1L;
    public static final long METRIC = 2L;
    public static final long NPT = 4L;
    public static final long CALIPER = 7L;

    public static final SpecFingerprint HALF_INCH_2A = new SpecFingerprint(".500-20", "2A", "UN", "plug");
    public static final SpecFingerprint HALF_INCH_3A = new SpecFingerprint(".500-20", "3A", "UN", "plug");

    private final JdbcTemplate jdbcTemplate;
    private final GaugeCategoryRepository categoryRepository;
    private final IdentifierSequenceRepository sequenceRepository;
    private final GaugeRepository gaugeRepository;

    private int serial;

    public GaugeTestData(JdbcTemplate jdbcTemplate, GaugeCategoryRepository categoryRepository,
                         IdentifierSequenceRepository sequenceRepository, GaugeRepository gaugeRepository) {
        this.jdbcTemplate = jdbcTemplate;
        this.categoryRepository = categoryRepository;
        this.sequenceRepository = sequenceRepository;
        this.gaugeRepository = gaugeRepository;
    }

    public void reset() {
        JdbcTestUtils.deleteFromTables(jdbcTemplate,
            "gauge_set_history", "gauges", "identifier_sequences", "gauge_categories");

        categoryRepository.save(category(STANDARD, "Standard", EquipmentClass.THREAD_GAUGE, false));
        categoryRepository.save(category(METRIC, "Metric", EquipmentClass.THREAD_GAUGE, false));
        categoryRepository.save(category(NPT, "NPT", EquipmentClass.THREAD_GAUGE, true));
        categoryRepository.save(category(CALIPER, "Caliper", EquipmentClass.HAND_TOOL, false));

        sequenceRepository.save(sequence(STANDARD, "set", "SP", 100));
        sequenceRepository.save(sequence(METRIC, "set", "MT", 1));
        sequenceRepository.save(sequence(NPT, IdentifierSequence.DEFAULT_SUB_TYPE, "NPT", 1));
        sequenceRepository.save(sequence(CALIPER, IdentifierSequence.DEFAULT_SUB_TYPE, "CA", 1));
    }

    public Gauge spare(long categoryId, SpecFingerprint spec) {
        return gaugeRepository.save(Gauge.builder()
            .serialNumber("SN-" + (++serial) + "-" + System.nanoTime())
            .equipmentClass(EquipmentClass.THREAD_GAUGE)
            .categoryId(categoryId)
            .specFingerprint(copy(spec))
            .spare(true)
            .build());
    }

    public Gauge spare() {
        return spare(STANDARD, HALF_INCH_2A);
    }

    public Gauge customerSpare(String customer) {
        Gauge gauge = spare();
        gauge.setOwnershipType(OwnershipType.CUSTOMER);
        gauge.setOwnerRef(customer);
        return gaugeRepository.save(gauge);
    }

    /**
     * A thread gauge in a non-pairable category, bypassing registration so the
     * engine's own checks are exercised.
     */
    public Gauge nonPairableThreadGauge(SpecFingerprint spec) {
        return gaugeRepository.save(Gauge.builder()
            .serialNumber("NPT-" + (++serial) + "-" + System.nanoTime())
            .equipmentClass(EquipmentClass.THREAD_GAUGE)
            .categoryId(NPT)
            .specFingerprint(copy(spec))
            .spare(true)
            .build());
    }

    public Gauge withStatus(Long gaugeId, GaugeStatus status) {
        Gauge gauge = gaugeRepository.findById(gaugeId).orElseThrow();
        gauge.setStatus(status);
        return gaugeRepository.save(gauge);
    }

    public Gauge reload(Gauge gauge) {
        return gaugeRepository.findById(gauge.getId()).orElseThrow();
    }

    private static SpecFingerprint copy(SpecFingerprint spec) {
        return new SpecFingerprint(spec.getSize(), spec.getThreadClass(), spec.getForm(), spec.getType());
    }

    private static GaugeCategory category(long id, String name, EquipmentClass equipmentClass, boolean nonPairable) {
        return GaugeCategory.builder().id(id).name(name).equipmentClass(equipmentClass).nonPairable(nonPairable).build();
    }

    private static IdentifierSequence sequence(long categoryId, String subType, String prefix, long nextValue) {
        return IdentifierSequence.builder().categoryId(categoryId).subType(subType).prefix(prefix).nextValue(nextValue).build();
    }
}
