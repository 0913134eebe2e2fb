package com.gauge.dto;

import com.gauge.model.SealState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Read view of a set.
 *
 * Provides:
 * - goGauge / noGoGauge: members by suffix, deleted ones included
 * - complete: both members are active
 * - retired: both members are soft-deleted
 * - compositeStatus / seal: derived from the two members, null for an incomplete set
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GaugeSetView {

    private String setId;
    private GaugeResponse goGauge;
    private GaugeResponse noGoGauge;
    private boolean complete;
    private boolean retired;
    private CompositeStatus compositeStatus;
    private SealState seal;
}
