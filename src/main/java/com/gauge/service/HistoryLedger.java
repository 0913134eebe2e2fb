package com.gauge.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gauge.model.HistoryEntry;
import com.gauge.model.HistoryPayload;
import com.gauge.model.LifecycleAction;
import com.gauge.repository.HistoryEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Append-only audit log of set lifecycle transitions.
 *
 * Entries are written in the caller's transaction, so a ledger entry exists
 * exactly when the transition it describes was committed. Nothing here updates
 * or deletes a row.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HistoryLedger {

    private final HistoryEntryRepository historyRepository;
    private final ObjectMapper objectMapper;

    @Transactional(propagation = Propagation.MANDATORY)
    public HistoryEntry append(LifecycleAction action, String identifier, String actorRef, String reason,
                               MemberSnapshot members, HistoryPayload payload) {
        if (!action.payloadType().isInstance(payload)) {
            throw new IllegalArgumentException(String.format(
                "Action %s expects payload %s but got %s", action, action.payloadType().getSimpleName(),
                payload == null ? "null" : payload.getClass().getSimpleName()));
        }

        HistoryEntry entry = HistoryEntry.builder()
            .identifier(identifier)
            .action(action)
            .actorRef(actorRef)
            .reason(reason)
            .occurredAt(Instant.now())
            .goGaugeId(members.goGaugeId())
            .noGoGaugeId(members.noGoGaugeId())
            .goExternalId(members.goExternalId())
            .noGoExternalId(members.noGoExternalId())
            .metadata(toJson(payload))
            .build();

        HistoryEntry saved = historyRepository.save(entry);
        log.debug("Ledger entry {} appended: {} on {} by {}", saved.getId(), action.code(), identifier, actorRef);
        return saved;
    }

    /**
     * True when any entry references the identifier, as a set identifier or as
     * a member's external id.
     */
    @Transactional(readOnly = true)
    public boolean hasEverBeenUsed(String identifier) {
        return historyRepository.referencesIdentifier(identifier);
    }

    @Transactional(readOnly = true)
    public List<HistoryEntry> historyFor(String setId) {
        return List.copyOf(historyRepository.findByIdentifierOrderByOccurredAtAscIdAsc(setId));
    }

    @Transactional(readOnly = true)
    public List<HistoryEntry> historyForGauge(Long gaugeId) {
        return List.copyOf(historyRepository.findByMember(gaugeId));
    }

    public HistoryPayload payloadOf(HistoryEntry entry) {
        if (entry.getMetadata() == null) {
            return null;
        }
        try {
            return objectMapper.readValue(entry.getMetadata(), entry.getAction().payloadType());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable metadata on ledger entry " + entry.getId(), e);
        }
    }

    private String toJson(HistoryPayload payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + payload.getClass().getSimpleName(), e);
        }
    }
}
