package com.gauge.dto;

import com.gauge.model.GaugeStatus;

import java.util.List;

public record CascadeResult(boolean cascaded, GaugeStatus status, List<Long> affectedGaugeIds) {}
