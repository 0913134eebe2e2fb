package com.gauge.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Technical specification tuple used for compatibility matching between set members.
 *
 * Two gauges can only be companions when all four components are equal.
 * Example: size ".500-20", class "2A", form "UN", type "plug".
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SpecFingerprint {

    @Column(name = "thread_size", length = 40)
    private String size;

    @Column(name = "thread_class", length = 20)
    private String threadClass;

    @Column(name = "thread_form", length = 20)
    private String form;

    @Column(name = "gauge_type", length = 20)
    private String type;

    public String describe() {
        return String.format("%s/%s %s %s",
            size, threadClass, form != null ? form : "-", type != null ? type : "-");
    }
}
