package com.gauge.service;

import com.gauge.exception.GaugeNotFoundException;
import com.gauge.exception.TransientStorageException;
import com.gauge.model.Gauge;
import com.gauge.model.GaugeCategory;
import com.gauge.repository.GaugeCategoryRepository;
import com.gauge.repository.GaugeRepository;
import com.gauge.repository.MembershipRef;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Locked access to gauge rows.
 *
 * Thread Safety Strategy:
 * - Rows are locked one at a time in ascending surrogate id order, whatever order
 *   the caller names them in, so two operations can never wait on each other in a cycle
 * - Discovery reads only ids, never entities, so the locked read hydrates current state
 * - Set membership is re-checked after locking; a change in between is reported as
 *   a retryable TransientStorageException
 */
@Component
@RequiredArgsConstructor
public class GaugeRecordStore {

    private final GaugeRepository gaugeRepository;
    private final GaugeCategoryRepository categoryRepository;

    /**
     * Lock the given gauges, deleted ones included.
     *
     * @return the locked gauges keyed by id, in ascending id order
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Map<Long, Gauge> lockInOrder(Collection<Long> gaugeIds) {
        TreeSet<Long> ordered = new TreeSet<>();
        gaugeIds.stream().filter(Objects::nonNull).forEach(ordered::add);

        Map<Long, Gauge> locked = new LinkedHashMap<>();
        for (Long id : ordered) {
            Gauge gauge = gaugeRepository.findByIdForUpdate(id)
                .orElseThrow(() -> new GaugeNotFoundException(
                    "Gauge " + id + " does not exist", "gaugeId", "an existing gauge", id));
            locked.put(id, gauge);
        }
        return locked;
    }

    /**
     * Discover and lock every row carrying the set id, deleted members included.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public List<Gauge> lockSetMembers(String setId) {
        List<Long> memberIds = gaugeRepository.findMemberIds(setId);
        if (memberIds.isEmpty()) {
            throw new GaugeNotFoundException("Set '" + setId + "' does not exist", "setId", "an existing set", setId);
        }

        List<Gauge> members = new ArrayList<>(lockInOrder(memberIds).values());
        for (Gauge member : members) {
            requireStillInSet(member, setId);
        }
        return members;
    }

    /**
     * Membership of a gauge as last committed, read without loading the entity.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public MembershipRef membershipOf(Long gaugeId) {
        return gaugeRepository.findMembership(gaugeId)
            .orElseThrow(() -> new GaugeNotFoundException(
                "Gauge " + gaugeId + " does not exist", "gaugeId", "an existing gauge", gaugeId));
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public List<Long> memberIdsOf(String setId) {
        return gaugeRepository.findMemberIds(setId);
    }

    public void requireStillInSet(Gauge gauge, String setId) {
        if (!Objects.equals(gauge.getSetId(), setId)) {
            throw new TransientStorageException(String.format(
                "Membership of set '%s' changed while it was being locked; please retry", setId));
        }
    }

    /**
     * Not @Transactional: an exception thrown through a transactional proxy would
     * mark the caller's transaction rollback-only, which breaks the compatibility dry run.
     */
    public GaugeCategory category(Long categoryId) {
        return categoryRepository.findById(categoryId)
            .orElseThrow(() -> new GaugeNotFoundException(
                "Gauge category " + categoryId + " does not exist", "categoryId", "an existing category", categoryId));
    }
}
