package com.gauge.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * One row of the append-only set history.
 *
 * No setters and @Immutable: Hibernate never issues an UPDATE for this entity.
 * The repository exposes no delete operation.
 */
@Entity
@Immutable
@Table(name = "gauge_set_history", indexes = {
    @Index(name = "idx_history_identifier_time", columnList = "identifier,occurredAt"),
    @Index(name = "idx_history_go_external", columnList = "goExternalId"),
    @Index(name = "idx_history_nogo_external", columnList = "noGoExternalId")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class HistoryEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** Set identifier, or the gauge identifier for single-gauge transitions. */
    @Column(nullable = false, length = 30, updatable = false)
    private String identifier;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 40, updatable = false)
    private LifecycleAction action;

    @Column(nullable = false, length = 100, updatable = false)
    private String actorRef;

    @Column(length = 500, updatable = false)
    private String reason;

    @Column(nullable = false, updatable = false)
    private Instant occurredAt;

    @Column(updatable = false)
    private Long goGaugeId;

    @Column(updatable = false)
    private Long noGoGaugeId;

    @Column(length = 30, updatable = false)
    private String goExternalId;

    @Column(length = 30, updatable = false)
    private String noGoExternalId;

    /** JSON form of the action's {@link HistoryPayload}. */
    @Lob
    @Column(updatable = false)
    private String metadata;
}
