package com.gauge.repository;

import com.gauge.model.GaugeCategory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface GaugeCategoryRepository extends JpaRepository<GaugeCategory, Long> {
}
