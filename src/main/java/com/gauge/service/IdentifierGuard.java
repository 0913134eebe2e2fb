package com.gauge.service;

import com.gauge.exception.GaugeValidationException;
import com.gauge.exception.IdentifierReusedException;
import com.gauge.model.SuffixPolicy;
import com.gauge.repository.GaugeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Hands out identifiers that have never been used by any gauge or set.
 *
 * A set identifier reserves the member ids derived from it ({@code <id>A} and
 * {@code <id>B}) as well, so all three are checked.
 * Allocated numbers that collide with an identifier claimed earlier (typically a
 * caller-supplied one) are consumed and skipped. Caller-supplied identifiers are
 * checked while holding the category's sequence row lock, which serializes
 * acceptance within the category; the unique external id constraint backs this up.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IdentifierGuard {

    private static final Pattern CUSTOM_IDENTIFIER = Pattern.compile("^[A-Z0-9-]{2,20}$");
    static final int MAX_SKIPPED = 1000;

    private final IdentifierAllocator allocator;
    private final GaugeRepository gaugeRepository;
    private final HistoryLedger historyLedger;

    @Transactional(propagation = Propagation.MANDATORY)
    public String issue(Long categoryId, String subType) {
        for (int skipped = 0; skipped < MAX_SKIPPED; skipped++) {
            String candidate = allocator.allocate(categoryId, subType, SuffixPolicy.NONE);
            if (!isTaken(candidate)) {
                return candidate;
            }
            log.warn("Identifier {} was claimed earlier; skipping to the next number", candidate);
        }
        throw new GaugeValidationException("IDENTIFIER_SPACE_EXHAUSTED", String.format(
            "No unused identifier found for category %d and sub-type '%s' after %d attempts",
            categoryId, subType, MAX_SKIPPED),
            "categoryId", "a sequence with unused numbers", categoryId);
    }

    /**
     * Accept a caller-supplied set identifier.
     *
     * @return the normalized identifier
     * @throws IdentifierReusedException if the identifier is in use or appears in history
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public String acceptCustom(String requested, Long categoryId, String subType) {
        String identifier = requested.trim().toUpperCase(Locale.ROOT);
        if (!CUSTOM_IDENTIFIER.matcher(identifier).matches()) {
            throw new GaugeValidationException("INVALID_IDENTIFIER",
                "Set ID '" + requested + "' must be 2-20 characters of A-Z, 0-9 or '-'",
                "customSetId", "[A-Z0-9-]{2,20}", requested);
        }

        allocator.lock(categoryId, subType);

        for (String reserved : reservedBy(identifier)) {
            if (gaugeRepository.isIdentifierActive(reserved)) {
                throw new IdentifierReusedException(inUseMessage(identifier, reserved),
                    "customSetId", "an unused identifier", identifier);
            }
        }
        for (String reserved : reservedBy(identifier)) {
            if (historyLedger.hasEverBeenUsed(reserved) || gaugeRepository.isIdentifierPresent(reserved)) {
                throw new IdentifierReusedException(reusedMessage(identifier, reserved),
                    "customSetId", "an identifier never used before", identifier);
            }
        }
        return identifier;
    }

    private boolean isTaken(String identifier) {
        return reservedBy(identifier).stream()
            .anyMatch(id -> gaugeRepository.isIdentifierPresent(id) || historyLedger.hasEverBeenUsed(id));
    }

    private static List<String> reservedBy(String setId) {
        return List.of(setId, setId + "A", setId + "B");
    }

    private static String inUseMessage(String setId, String reserved) {
        if (setId.equals(reserved)) {
            return "Set ID '" + setId + "' is already in use";
        }
        return "Set ID '" + setId + "' would collide with identifier '" + reserved + "', which is in use";
    }

    private static String reusedMessage(String setId, String reserved) {
        if (setId.equals(reserved)) {
            return "Set ID '" + setId + "' was previously used and cannot be reused";
        }
        return "Set ID '" + setId + "' would reuse identifier '" + reserved + "', which was previously used";
    }
}
