package com.gauge.service;

import com.gauge.exception.GaugeValidationException;
import com.gauge.exception.IdentifierReusedException;
import com.gauge.model.SuffixPolicy;
import com.gauge.repository.GaugeRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for IdentifierGuard with the allocator and lookups mocked out.
 */
@ExtendWith(MockitoExtension.class)
class IdentifierGuardTest {

    @Mock
    private IdentifierAllocator allocator;

    @Mock
    private GaugeRepository gaugeRepository;

    @Mock
    private HistoryLedger historyLedger;

    @InjectMocks
    private IdentifierGuard guard;

    /**
     * Test 1: Every allocated number already claimed → IDENTIFIER_SPACE_EXHAUSTED
     */
    @Test
    void testExhaustedSequenceIsRejected() {
        when(allocator.allocate(1L, "set", SuffixPolicy.NONE)).thenReturn("SP9999");
        when(gaugeRepository.isIdentifierPresent("SP9999")).thenReturn(true);

        GaugeValidationException ex = assertThrows(GaugeValidationException.class, () -> guard.issue(1L, "set"));

        assertEquals("IDENTIFIER_SPACE_EXHAUSTED", ex.getCode());
        assertEquals(1L, ex.getActual());
        verify(allocator, times(IdentifierGuard.MAX_SKIPPED)).allocate(1L, "set", SuffixPolicy.NONE);
    }

    /**
     * Test 2: A number whose derived member id was used before is skipped
     */
    @Test
    void testSkipsNumberWhoseMemberIdWasUsed() {
        when(allocator.allocate(1L, "set", SuffixPolicy.NONE)).thenReturn("SP0100", "SP0101");
        when(historyLedger.hasEverBeenUsed(anyString())).thenReturn(false);
        when(gaugeRepository.isIdentifierPresent(anyString())).thenReturn(false);
        when(historyLedger.hasEverBeenUsed("SP0100B")).thenReturn(true);

        assertEquals("SP0101", guard.issue(1L, "set"));
    }

    /**
     * Test 3: A custom id whose derived member id is active is rejected as in use
     */
    @Test
    void testCustomIdCollidingWithActiveMemberId() {
        when(gaugeRepository.isIdentifierActive(anyString())).thenReturn(false);
        when(gaugeRepository.isIdentifierActive("AB7B")).thenReturn(true);

        IdentifierReusedException ex = assertThrows(IdentifierReusedException.class,
            () -> guard.acceptCustom(" ab7 ", 1L, "set"));

        assertTrue(ex.getMessage().contains("AB7B"));
        assertTrue(ex.getMessage().contains("in use"));
        verify(allocator).lock(1L, "set");
    }

    /**
     * Test 4: A custom id with all three identifiers unused is accepted and normalized
     */
    @Test
    void testCustomIdAccepted() {
        assertEquals("AB7", guard.acceptCustom("ab7", 1L, "set"));
        verify(historyLedger).hasEverBeenUsed("AB7A");
        verify(gaugeRepository).isIdentifierPresent("AB7B");
    }
}
