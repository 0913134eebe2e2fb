package com.gauge.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Reference data: a gauge category such as "Standard", "Metric" or "NPT".
 *
 * nonPairable marks categories whose gauges are always single (e.g. NPT tapered
 * thread gauges), even though their equipment class is pairable.
 */
@Entity
@Table(name = "gauge_categories")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GaugeCategory {

    @Id
    private Long id;

    @Column(nullable = false, length = 100)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private EquipmentClass equipmentClass;

    @Column(nullable = false)
    private boolean nonPairable;
}
