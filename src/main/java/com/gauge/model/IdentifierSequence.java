package com.gauge.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Counter row for one (category, sub-type) pair.
 *
 * nextValue only moves forward. Rows are locked with PESSIMISTIC_WRITE for the
 * duration of the allocating transaction.
 */
@Entity
@Table(name = "identifier_sequences", uniqueConstraints =
    @UniqueConstraint(name = "uq_sequence_category_subtype", columnNames = {"categoryId", "subType"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IdentifierSequence {

    public static final String DEFAULT_SUB_TYPE = "default";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long categoryId;

    @Column(nullable = false, length = 20)
    private String subType;

    /** 2-4 upper-case letters, e.g. "SP". */
    @Column(nullable = false, length = 4)
    private String prefix;

    @Column(nullable = false)
    private long nextValue;
}
