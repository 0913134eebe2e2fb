package com.gauge.service;

import com.gauge.exception.ConfigurationException;
import com.gauge.model.IdentifierSequence;
import com.gauge.model.SuffixPolicy;
import com.gauge.repository.IdentifierSequenceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Issues human-readable identifiers from per (category, sub-type) counters.
 *
 * Thread Safety Strategy:
 * - The counter row is locked with SELECT ... FOR UPDATE inside the caller's transaction
 * - The lock is released only at commit or rollback, so no two callers read the same value
 * - Allocation outside a transaction is rejected (Propagation.MANDATORY)
 *
 * Numbers are never reset or reused. Past 9999 the numeric part simply widens.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdentifierAllocator {

    private final IdentifierSequenceRepository sequenceRepository;

    /**
     * Allocate the next identifier, e.g. "SP0100" or "SP0100A".
     *
     * @throws ConfigurationException if no sequence row exists for the pair
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public String allocate(Long categoryId, String subType, SuffixPolicy suffixPolicy) {
        IdentifierSequence sequence = lock(categoryId, subType);

        long value = sequence.getNextValue();
        sequence.setNextValue(value + 1);

        String identifier = format(sequence.getPrefix(), value, suffixPolicy);
        log.debug("Allocated identifier {} (category={}, subType={})", identifier, categoryId, sequence.getSubType());
        return identifier;
    }

    /**
     * Lock the sequence row without consuming a number. Used to serialize
     * acceptance of caller-supplied identifiers within a category.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public IdentifierSequence lock(Long categoryId, String subType) {
        String normalized = normalize(subType);
        return sequenceRepository.findForUpdate(categoryId, normalized)
            .orElseThrow(() -> new ConfigurationException(String.format(
                "No identifier sequence configured for category %d and sub-type '%s'", categoryId, normalized)));
    }

    /**
     * The identifier the next allocation would return. Consumes nothing and takes no lock,
     * so it is only a suggestion.
     */
    @Transactional(readOnly = true)
    public String peek(Long categoryId, String subType, SuffixPolicy suffixPolicy) {
        String normalized = normalize(subType);
        IdentifierSequence sequence = sequenceRepository.findByCategoryIdAndSubType(categoryId, normalized)
            .orElseThrow(() -> new ConfigurationException(String.format(
                "No identifier sequence configured for category %d and sub-type '%s'", categoryId, normalized)));
        return format(sequence.getPrefix(), sequence.getNextValue(), suffixPolicy);
    }

    static String format(String prefix, long value, SuffixPolicy suffixPolicy) {
        SuffixPolicy policy = suffixPolicy != null ? suffixPolicy : SuffixPolicy.NONE;
        return String.format("%s%04d%s", prefix, value, policy.suffix());
    }

    private static String normalize(String subType) {
        return subType == null || subType.isBlank() ? IdentifierSequence.DEFAULT_SUB_TYPE : subType;
    }
}
