package com.gauge.service;

import com.gauge.config.LifecycleProperties;
import com.gauge.dto.*;
import com.gauge.exception.*;
import com.gauge.inventory.InventoryClient;
import com.gauge.model.*;
import com.gauge.repository.GaugeRepository;
import com.gauge.repository.MembershipRef;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;

/**
 * Gauge set lifecycle engine: pairing, replacement, unpairing, retirement and
 * the cascades that keep both members of a set consistent.
 *
 * Thread Safety Strategy:
 * - Each operation is one bounded transaction (LifecycleTransactions)
 * - Every touched gauge row is locked before any precondition is evaluated,
 *   always in ascending id order (GaugeRecordStore)
 * - Exactly one ledger entry is appended per committed transition, in the same transaction
 * - Any failure rolls the whole operation back; nothing is retried here
 *
 * Inventory relocation is best effort: a failing inventory call is logged and the
 * lifecycle transition still commits.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GaugeSetService {

    private final LifecycleTransactions transactions;
    private final GaugeRecordStore recordStore;
    private final IdentifierGuard identifierGuard;
    private final HistoryLedger historyLedger;
    private final GaugeRepository gaugeRepository;
    private final InventoryClient inventoryClient;
    private final LifecycleProperties properties;

    /**
     * Pair two spares into a new set.
     *
     * Preconditions, first failure wins:
     * 1. Both gauges exist and are not deleted
     * 2. They are two different gauges
     * 3. Both are spares (not in a set)
     * 4. Both are thread gauges and their category is pairable
     * 5. Specifications match
     * 6. Ownership matches
     * 7. Same category
     * 8. Neither is pending QC
     *
     * @return the new set id
     */
    public String pairFromSpares(PairSparesRequest request, String actorRef) {
        requireActor(actorRef);
        if (properties.requireLocationOnPair() && isBlank(request.getLocation())) {
            throw new GaugeValidationException("LOCATION_REQUIRED",
                "A storage location is required when pairing gauges", "location", "a location", null);
        }
        requireDifferent(request.getGoGaugeId(), request.getNoGoGaugeId());

        String setId = transactions.write("pairFromSpares", () -> {
            Map<Long, Gauge> locked = recordStore.lockInOrder(List.of(request.getGoGaugeId(), request.getNoGoGaugeId()));
            Gauge go = locked.get(request.getGoGaugeId());
            Gauge noGo = locked.get(request.getNoGoGaugeId());

            validatePairing(go, noGo);

            boolean custom = !isBlank(request.getCustomSetId());
            String newSetId = custom
                ? identifierGuard.acceptCustom(request.getCustomSetId(), go.getCategoryId(), properties.setSequenceSubType())
                : identifierGuard.issue(go.getCategoryId(), properties.setSequenceSubType());

            go.attachToSet(newSetId, GaugeSuffix.A, noGo.getId());
            noGo.attachToSet(newSetId, GaugeSuffix.B, go.getId());

            if (!isBlank(request.getLocation())) {
                relocateQuietly(go, request.getLocation(), actorRef, "Paired into set " + newSetId);
                relocateQuietly(noGo, request.getLocation(), actorRef, "Paired into set " + newSetId);
            }

            historyLedger.append(LifecycleAction.PAIRED_FROM_SPARES, newSetId, actorRef, trimToNull(request.getReason()),
                MemberSnapshot.of(go, noGo),
                new HistoryPayload.Paired(newSetId, go.getId(), noGo.getId(), request.getLocation(), custom));
            return newSetId;
        });

        log.info("Paired spares {} and {} into set {} by {}",
                 request.getGoGaugeId(), request.getNoGoGaugeId(), setId, actorRef);
        return setId;
    }

    /**
     * Swap one member of a set for a spare. The replaced gauge returns to the spare
     * pool, the replacement takes over its suffix and external id.
     *
     * @param setId the set the caller expects the existing gauge to belong to
     */
    public GaugeSetView replaceMember(String setId, ReplaceMemberRequest request, String actorRef) {
        requireActor(actorRef);
        String reason = requireReason(request.getReason(), "replacement");
        Long existingId = request.getExistingGaugeId();
        Long replacementId = request.getReplacementGaugeId();
        requireDifferent(existingId, replacementId);

        String replacedIn = transactions.write("replaceMember", () -> {
            MembershipRef membership = recordStore.membershipOf(existingId);
            if (membership.setId() == null) {
                throw notInSet(existingId);
            }
            if (!membership.setId().equals(setId)) {
                throw notInSet(existingId, setId, membership.setId());
            }
            String currentSetId = membership.setId();
            Long companionId = recordStore.memberIdsOf(currentSetId).stream()
                .filter(id -> !id.equals(existingId))
                .findFirst()
                .orElseThrow(() -> incompleteSet(currentSetId, 1));

            Map<Long, Gauge> locked = recordStore.lockInOrder(List.of(existingId, companionId, replacementId));
            Gauge existing = locked.get(existingId);
            Gauge companion = locked.get(companionId);
            Gauge replacement = locked.get(replacementId);

            if (existing.getSetId() == null) {
                throw notInSet(existingId);
            }
            recordStore.requireStillInSet(existing, currentSetId);
            recordStore.requireStillInSet(companion, currentSetId);
            if (companion.isDeleted()) {
                throw incompleteSet(currentSetId, 1);
            }

            requireIdle(existing);
            requireIdle(companion);

            requireActive(replacement, "replacementGaugeId");
            requireSpare(replacement);
            requirePairable(replacement);
            requireMatchingSpec(companion, replacement);
            requireNotPendingQc(replacement);
            requireSameOwner(companion, replacement);

            GaugeSuffix suffix = existing.getSuffix() != null
                ? existing.getSuffix()
                : companion.getSuffix() != null ? companion.getSuffix().other() : GaugeSuffix.A;

            // the old row must release the external id before the replacement claims it
            existing.detachFromSet();
            gaugeRepository.flush();
            replacement.attachToSet(currentSetId, suffix, companion.getId());
            companion.setCompanionId(replacement.getId());

            currentLocation(companion).ifPresent(location ->
                relocateQuietly(replacement, location, actorRef, "Joined set " + currentSetId));

            Gauge go = suffix == GaugeSuffix.A ? replacement : companion;
            Gauge noGo = suffix == GaugeSuffix.A ? companion : replacement;
            historyLedger.append(LifecycleAction.REPLACED, currentSetId, actorRef, reason,
                MemberSnapshot.of(go, noGo),
                new HistoryPayload.Replaced(currentSetId, existing.getId(), replacement.getId(), companion.getId(), suffix));
            return currentSetId;
        });

        log.info("Replaced gauge {} with {} in set {} by {}: {}", existingId, replacementId, replacedIn, actorRef, reason);
        return getSet(replacedIn);
    }

    /**
     * Dissolve a set; both members become spares. The set id is never issued again.
     */
    public void unpair(String setId, String actorRef, String reason) {
        requireActor(actorRef);

        transactions.write("unpair", () -> {
            List<Gauge> members = lockActivePair(setId);
            Gauge go = members.get(0);
            Gauge noGo = members.get(1);
            requireIdle(go);
            requireIdle(noGo);

            MemberSnapshot snapshot = MemberSnapshot.of(go, noGo);
            go.detachFromSet();
            noGo.detachFromSet();

            historyLedger.append(LifecycleAction.UNPAIRED, setId, actorRef, trimToNull(reason), snapshot,
                new HistoryPayload.Unpaired(setId, go.getId(), noGo.getId()));
        });

        log.info("Unpaired set {} by {}", setId, actorRef);
    }

    /**
     * Permanently take both members out of service. Set linkage is kept for audit.
     */
    public void retire(String setId, String actorRef, String reason) {
        requireActor(actorRef);
        String required = requireReason(reason, "retirement");

        transactions.write("retire", () -> {
            List<Gauge> members = lockActivePair(setId);
            Gauge go = members.get(0);
            Gauge noGo = members.get(1);
            requireIdle(go);
            requireIdle(noGo);

            Instant now = Instant.now();
            for (Gauge member : members) {
                member.setDeletedAt(now);
                member.setStatus(GaugeStatus.RETIRED);
            }

            historyLedger.append(LifecycleAction.RETIRED, setId, actorRef, required, MemberSnapshot.of(go, noGo),
                new HistoryPayload.Retired(setId, go.getId(), noGo.getId(), now));
        });

        log.info("Retired set {} by {}: {}", setId, actorRef, required);
    }

    /**
     * Register two new thread gauges and pair them at creation time.
     */
    public GaugeSetView createSet(CreateSetRequest request, String actorRef) {
        requireActor(actorRef);
        if (request.getGoSerialNumber().trim().equalsIgnoreCase(request.getNoGoSerialNumber().trim())) {
            throw new GaugeValidationException("DUPLICATE_SERIAL_NUMBER",
                "GO and NO-GO gauges cannot share serial number " + request.getGoSerialNumber(),
                "noGoSerialNumber", "a different serial number", request.getNoGoSerialNumber());
        }

        String setId = transactions.write("createSet", () -> {
            GaugeCategory category = recordStore.category(request.getCategoryId());
            requirePairableCategory(category);

            boolean custom = !isBlank(request.getCustomSetId());
            String newSetId = custom
                ? identifierGuard.acceptCustom(request.getCustomSetId(), category.getId(), properties.setSequenceSubType())
                : identifierGuard.issue(category.getId(), properties.setSequenceSubType());

            // checked under the sequence row lock taken above
            requireUnusedSerial(request.getGoSerialNumber(), "goSerialNumber");
            requireUnusedSerial(request.getNoGoSerialNumber(), "noGoSerialNumber");

            Gauge go = gaugeRepository.save(newSetMember(request, category, request.getGoSerialNumber().trim()));
            Gauge noGo = gaugeRepository.save(newSetMember(request, category, request.getNoGoSerialNumber().trim()));
            go.attachToSet(newSetId, GaugeSuffix.A, noGo.getId());
            noGo.attachToSet(newSetId, GaugeSuffix.B, go.getId());

            if (!isBlank(request.getLocation())) {
                relocateQuietly(go, request.getLocation(), actorRef, "Created as set " + newSetId);
                relocateQuietly(noGo, request.getLocation(), actorRef, "Created as set " + newSetId);
            }

            historyLedger.append(LifecycleAction.CREATED, newSetId, actorRef, trimToNull(request.getReason()),
                MemberSnapshot.of(go, noGo),
                new HistoryPayload.Created(newSetId, go.getId(), noGo.getId(), category.getId(),
                    request.getSpec().describe()));
            return newSetId;
        });

        log.info("Created set {} in category {} by {}", setId, request.getCategoryId(), actorRef);
        return getSet(setId);
    }

    /**
     * Take a gauge out of service or return it to service. When the gauge is in a
     * set its companion follows in the same transaction.
     */
    public CascadeResult cascadeStatus(Long gaugeId, GaugeStatus newStatus, String actorRef, String reason) {
        requireActor(actorRef);
        LifecycleAction action;
        if (newStatus == GaugeStatus.OUT_OF_SERVICE) {
            action = LifecycleAction.CASCADED_OUT_OF_SERVICE;
        } else if (newStatus == GaugeStatus.AVAILABLE) {
            action = LifecycleAction.CASCADED_RETURN_TO_SERVICE;
        } else {
            throw new GaugeValidationException("INVALID_STATUS",
                "Only out_of_service and available can be set here, not " + (newStatus == null ? null : newStatus.code()),
                "status", "out_of_service or available", newStatus);
        }

        CascadeResult result = transactions.write("cascadeStatus", () -> {
            MembershipRef membership = recordStore.membershipOf(gaugeId);
            List<Long> ids = new ArrayList<>();
            ids.add(gaugeId);
            if (membership.companionId() != null) {
                ids.add(membership.companionId());
            }

            Map<Long, Gauge> locked = recordStore.lockInOrder(ids);
            Gauge gauge = locked.get(gaugeId);
            requireActive(gauge, "gaugeId");
            if (!Objects.equals(gauge.getCompanionId(), membership.companionId())) {
                throw new TransientStorageException("Set membership of gauge " + gaugeId + " changed; please retry");
            }

            Gauge companion = gauge.getCompanionId() != null ? locked.get(gauge.getCompanionId()) : null;
            gauge.setStatus(newStatus);
            if (companion == null || companion.isDeleted()) {
                return new CascadeResult(false, newStatus, List.of(gauge.getId()));
            }

            companion.setStatus(newStatus);
            Gauge go = gauge.getSuffix() == GaugeSuffix.B ? companion : gauge;
            Gauge noGo = go == gauge ? companion : gauge;
            historyLedger.append(action, gauge.getSetId(), actorRef, trimToNull(reason), MemberSnapshot.of(go, noGo),
                new HistoryPayload.StatusCascaded(gauge.getSetId(), gauge.getId(), companion.getId(), newStatus));
            return new CascadeResult(true, newStatus, List.of(go.getId(), noGo.getId()));
        });

        log.info("Status of gauge {} set to {} by {} (cascaded={})", gaugeId, newStatus.code(), actorRef, result.cascaded());
        return result;
    }

    /**
     * Move both members of a set to a new storage location.
     */
    public void relocateSet(String setId, String location, String actorRef, String reason) {
        requireActor(actorRef);
        if (isBlank(location)) {
            throw new GaugeValidationException("LOCATION_REQUIRED", "A target location is required",
                "location", "a location", location);
        }

        transactions.write("relocateSet", () -> {
            List<Gauge> members = lockActivePair(setId);
            for (Gauge member : members) {
                relocateQuietly(member, location, actorRef, reason != null ? reason : "Set " + setId + " relocated");
            }
            historyLedger.append(LifecycleAction.CASCADED_LOCATION, setId, actorRef, trimToNull(reason),
                MemberSnapshot.of(members.get(0), members.get(1)), new HistoryPayload.Relocated(setId, location));
        });

        log.info("Relocated set {} to {} by {}", setId, location, actorRef);
    }

    /**
     * Dry run of the pairing rules. Takes no locks and writes nothing.
     */
    public CompatibilityResult checkCompatibility(Long goGaugeId, Long noGoGaugeId) {
        return transactions.read("checkCompatibility", () -> {
            try {
                requireDifferent(goGaugeId, noGoGaugeId);
                Gauge go = findGauge(goGaugeId);
                Gauge noGo = findGauge(noGoGaugeId);
                validatePairing(go, noGo);
                return CompatibilityResult.ok();
            } catch (GaugeValidationException e) {
                return new CompatibilityResult(false, e.getCode(), e.getMessage());
            }
        });
    }

    public GaugeSetView getSet(String setId) {
        return transactions.read("getSet", () -> {
            List<Gauge> members = gaugeRepository.findBySetIdOrderByIdAsc(setId);
            if (members.isEmpty()) {
                throw new GaugeNotFoundException("Set '" + setId + "' does not exist", "setId", "an existing set", setId);
            }
            return toView(setId, members);
        });
    }

    public List<GaugeResponse> findSpares(Long categoryId) {
        return transactions.read("findSpares", () -> gaugeRepository.findSpares(categoryId).stream()
            .map(GaugeResponse::from)
            .toList());
    }

    /**
     * Sets with one soft-deleted and one active member. They stay listed until an
     * operator replaces the lost member.
     */
    public List<GaugeSetView> findIncompleteSets() {
        return transactions.read("findIncompleteSets", () -> gaugeRepository.findIncompleteSetIds().stream()
            .map(setId -> toView(setId, gaugeRepository.findBySetIdOrderByIdAsc(setId)))
            .toList());
    }

    public List<HistoryEntryResponse> history(String setId) {
        return transactions.read("history", () -> toHistoryResponses(historyLedger.historyFor(setId)));
    }

    public List<HistoryEntryResponse> historyForGauge(Long gaugeId) {
        return transactions.read("historyForGauge", () -> toHistoryResponses(historyLedger.historyForGauge(gaugeId)));
    }

    // ---------------------------------------------------------------------------------
    // Preconditions
    // ---------------------------------------------------------------------------------

    private void validatePairing(Gauge go, Gauge noGo) {
        requireActive(go, "goGaugeId");
        requireActive(noGo, "noGoGaugeId");
        requireSpare(go);
        requireSpare(noGo);
        requirePairable(go);
        requirePairable(noGo);
        requireMatchingSpec(go, noGo);
        requireSameOwner(go, noGo);
        if (!Objects.equals(go.getCategoryId(), noGo.getCategoryId())) {
            throw new GaugeValidationException("CATEGORY_MISMATCH",
                String.format("Gauges %d and %d belong to different categories", go.getId(), noGo.getId()),
                "categoryId", go.getCategoryId(), noGo.getCategoryId());
        }
        requireNotPendingQc(go);
        requireNotPendingQc(noGo);
    }

    private void requireActive(Gauge gauge, String field) {
        if (gauge.isDeleted()) {
            throw new GaugeNotFoundException("Gauge " + gauge.getId() + " has been deleted",
                field, "an active gauge", gauge.getId());
        }
    }

    private void requireSpare(Gauge gauge) {
        if (gauge.isInSet()) {
            throw new AlreadyPairedException(
                String.format("Gauge %s is already in set %s", label(gauge), gauge.getSetId()),
                "setId", null, gauge.getSetId());
        }
    }

    private void requirePairable(Gauge gauge) {
        if (!gauge.getEquipmentClass().isPairable()) {
            throw new NonPairableCategoryException(
                String.format("Gauge %s is a %s; only thread gauges can be paired", label(gauge), gauge.getEquipmentClass()),
                "equipmentClass", EquipmentClass.THREAD_GAUGE, gauge.getEquipmentClass());
        }
        requirePairableCategory(recordStore.category(gauge.getCategoryId()));
    }

    private void requirePairableCategory(GaugeCategory category) {
        if (!category.getEquipmentClass().isPairable() || category.isNonPairable()) {
            throw new NonPairableCategoryException(
                String.format("%s gauges cannot be paired", category.getName()),
                "categoryId", "a pairable category", category.getName());
        }
    }

    private void requireMatchingSpec(Gauge reference, Gauge candidate) {
        SpecFingerprint expected = reference.getSpecFingerprint() != null ? reference.getSpecFingerprint() : new SpecFingerprint();
        SpecFingerprint actual = candidate.getSpecFingerprint() != null ? candidate.getSpecFingerprint() : new SpecFingerprint();
        specField("threadSize", expected.getSize(), actual.getSize(), reference, candidate);
        specField("threadClass", expected.getThreadClass(), actual.getThreadClass(), reference, candidate);
        specField("threadForm", expected.getForm(), actual.getForm(), reference, candidate);
        specField("gaugeType", expected.getType(), actual.getType(), reference, candidate);
    }

    private void specField(String field, String expected, String actual, Gauge reference, Gauge candidate) {
        if (!Objects.equals(expected, actual)) {
            throw new SpecMismatchException(
                String.format("Gauge %s %s is %s but gauge %s has %s",
                    label(candidate), field, actual, label(reference), expected),
                field, expected, actual);
        }
    }

    private void requireSameOwner(Gauge reference, Gauge candidate) {
        if (!reference.sameOwnerAs(candidate)) {
            throw new OwnershipMismatchException(
                String.format("Gauge %s is owned by %s but gauge %s is owned by %s",
                    label(candidate), candidate.ownerDescription(), label(reference), reference.ownerDescription()),
                "ownership", reference.ownerDescription(), candidate.ownerDescription());
        }
    }

    private void requireNotPendingQc(Gauge gauge) {
        if (gauge.getStatus() == GaugeStatus.PENDING_QC) {
            throw new GaugeValidationException("PENDING_QC",
                "Gauge " + label(gauge) + " is pending QC and cannot join a set",
                "status", "not pending_qc", gauge.getStatus().code());
        }
    }

    /** Not checked out and not inside the calibration workflow. */
    private void requireIdle(Gauge gauge) {
        if (gauge.getStatus() == GaugeStatus.CHECKED_OUT) {
            throw new CheckedOutException("Gauge " + label(gauge) + " is checked out",
                "status", "not checked_out", gauge.getStatus().code());
        }
        if (gauge.getStatus().isInCalibration()) {
            throw new InCalibrationException("Gauge " + label(gauge) + " is in calibration",
                "status", "not in calibration", gauge.getStatus().code());
        }
    }

    private void requireUnusedSerial(String serialNumber, String field) {
        if (gaugeRepository.existsThreadGaugeWithSerialNumber(serialNumber.trim())) {
            throw new GaugeValidationException("DUPLICATE_SERIAL_NUMBER",
                "A thread gauge with serial number " + serialNumber + " already exists",
                field, "a unique serial number", serialNumber);
        }
    }

    private void requireDifferent(Long goGaugeId, Long noGoGaugeId) {
        if (Objects.equals(goGaugeId, noGoGaugeId)) {
            throw new GaugeValidationException("SAME_GAUGE", "A gauge cannot be paired with itself",
                "noGoGaugeId", "a different gauge", noGoGaugeId);
        }
    }

    private static void requireActor(String actorRef) {
        if (isBlank(actorRef)) {
            throw new GaugeValidationException("MISSING_ACTOR", "An actor is required for lifecycle changes",
                "actorRef", "an actor reference", actorRef);
        }
    }

    private static String requireReason(String reason, String operation) {
        if (isBlank(reason)) {
            throw new GaugeValidationException("MISSING_REASON", "A reason is required for " + operation,
                "reason", "a non-empty reason", reason);
        }
        return reason.trim();
    }

    // ---------------------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------------------

    /**
     * Lock a set and return its two active members, GO first.
     */
    private List<Gauge> lockActivePair(String setId) {
        List<Gauge> active = recordStore.lockSetMembers(setId).stream()
            .filter(g -> !g.isDeleted())
            .toList();
        if (active.size() != 2) {
            throw incompleteSet(setId, active.size());
        }
        return orderBySuffix(active);
    }

    private static List<Gauge> orderBySuffix(List<Gauge> members) {
        List<Gauge> ordered = new ArrayList<>(members);
        ordered.sort(Comparator
            .comparing((Gauge g) -> g.getSuffix() == null ? 2 : g.getSuffix().ordinal())
            .thenComparing(Gauge::getId));
        return ordered;
    }

    private Gauge findGauge(Long id) {
        return gaugeRepository.findById(id)
            .orElseThrow(() -> new GaugeNotFoundException("Gauge " + id + " does not exist",
                "gaugeId", "an existing gauge", id));
    }

    private Gauge newSetMember(CreateSetRequest request, GaugeCategory category, String serialNumber) {
        return Gauge.builder()
            .serialNumber(serialNumber)
            .equipmentClass(category.getEquipmentClass())
            .categoryId(category.getId())
            .specFingerprint(request.getSpec())
            .ownershipType(request.getOwnershipType() != null ? request.getOwnershipType() : OwnershipType.COMPANY)
            .ownerRef(request.getOwnerRef())
            .spare(false)
            .build();
    }

    private Optional<String> currentLocation(Gauge gauge) {
        try {
            return inventoryClient.currentLocation(gauge.itemRef());
        } catch (RuntimeException e) {
            log.warn("Could not read location of {}: {}", gauge.itemRef(), e.getMessage());
            return Optional.empty();
        }
    }

    private void relocateQuietly(Gauge gauge, String location, String actorRef, String note) {
        try {
            inventoryClient.relocate(gauge.itemRef(), location, actorRef, note);
        } catch (RuntimeException e) {
            log.warn("Relocation of {} to {} failed, lifecycle change kept: {}", gauge.itemRef(), location, e.getMessage());
        }
    }

    private GaugeSetView toView(String setId, List<Gauge> members) {
        List<Gauge> ordered = orderBySuffix(members);
        Gauge go = ordered.get(0);
        Gauge noGo = ordered.size() > 1 ? ordered.get(1) : null;
        boolean complete = noGo != null && !go.isDeleted() && !noGo.isDeleted();
        boolean retired = ordered.stream().allMatch(Gauge::isDeleted);

        return GaugeSetView.builder()
            .setId(setId)
            .goGauge(GaugeResponse.from(go))
            .noGoGauge(noGo != null ? GaugeResponse.from(noGo) : null)
            .complete(complete)
            .retired(retired)
            .compositeStatus(noGo != null ? SetStatusAggregator.compositeStatus(go, noGo) : null)
            .seal(noGo != null ? SetStatusAggregator.compositeSeal(go, noGo) : null)
            .build();
    }

    private List<HistoryEntryResponse> toHistoryResponses(List<HistoryEntry> entries) {
        return entries.stream()
            .map(entry -> HistoryEntryResponse.builder()
                .id(entry.getId())
                .identifier(entry.getIdentifier())
                .action(entry.getAction())
                .actorRef(entry.getActorRef())
                .reason(entry.getReason())
                .occurredAt(entry.getOccurredAt())
                .goGaugeId(entry.getGoGaugeId())
                .noGoGaugeId(entry.getNoGoGaugeId())
                .goExternalId(entry.getGoExternalId())
                .noGoExternalId(entry.getNoGoExternalId())
                .metadata(historyLedger.payloadOf(entry))
                .build())
            .toList();
    }

    private static GaugeValidationException notInSet(Long gaugeId) {
        return new GaugeValidationException("NOT_IN_SET", "Gauge " + gaugeId + " is not in a set",
            "setId", "a set id", null);
    }

    private static GaugeValidationException notInSet(Long gaugeId, String expectedSetId, String actualSetId) {
        return new GaugeValidationException("NOT_IN_SET",
            String.format("Gauge %d is not part of set %s", gaugeId, expectedSetId),
            "setId", expectedSetId, actualSetId);
    }

    private static GaugeValidationException incompleteSet(String setId, int activeMembers) {
        return new GaugeValidationException("INCOMPLETE_SET",
            String.format("Set '%s' has %d active member(s); expected 2", setId, activeMembers),
            "setId", 2, activeMembers);
    }

    private static String label(Gauge gauge) {
        return gauge.itemRef() != null ? gauge.itemRef() : String.valueOf(gauge.getId());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String trimToNull(String value) {
        return isBlank(value) ? null : value.trim();
    }
}
