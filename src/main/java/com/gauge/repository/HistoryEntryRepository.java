package com.gauge.repository;

import com.gauge.model.HistoryEntry;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

import java.util.List;

/**
 * Append-only access to the set history.
 *
 * Extends the bare Repository marker on purpose: only save and finders are
 * exposed, no update or delete methods exist.
 */
public interface HistoryEntryRepository extends Repository<HistoryEntry, Long> {

    HistoryEntry save(HistoryEntry entry);

    List<HistoryEntry> findByIdentifierOrderByOccurredAtAscIdAsc(String identifier);

    @Query("SELECT h FROM HistoryEntry h WHERE h.goGaugeId = :gaugeId OR h.noGoGaugeId = :gaugeId " +
           "ORDER BY h.occurredAt ASC, h.id ASC")
    List<HistoryEntry> findByMember(@Param("gaugeId") Long gaugeId);

    @Query("SELECT COUNT(h) > 0 FROM HistoryEntry h WHERE h.identifier = :identifier " +
           "OR h.goExternalId = :identifier OR h.noGoExternalId = :identifier")
    boolean referencesIdentifier(@Param("identifier") String identifier);

    long count();
}
