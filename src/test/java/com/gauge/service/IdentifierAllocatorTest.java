package com.gauge.service;

import com.gauge.GaugeTestData;
import com.gauge.exception.ConfigurationException;
import com.gauge.model.IdentifierSequence;
import com.gauge.model.SuffixPolicy;
import com.gauge.repository.GaugeCategoryRepository;
import com.gauge.repository.GaugeRepository;
import com.gauge.repository.IdentifierSequenceRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.IllegalTransactionStateException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Identifier allocation.
 *
 * Tests cover:
 * 1. Format prefix + 4-digit number + suffix
 * 2. Missing sequence row
 * 3. Allocation outside a transaction
 * 4. Concurrent allocations are distinct and strictly increasing
 * 5. Widening past 9999
 * 6. Peek does not consume
 */
@SpringBootTest
@ActiveProfiles("test")
class IdentifierAllocatorTest {

    @Autowired
    private IdentifierAllocator allocator;

    @Autowired
    private LifecycleTransactions transactions;

    @Autowired
    private IdentifierSequenceRepository sequenceRepository;

    @Autowired
    private GaugeCategoryRepository categoryRepository;

    @Autowired
    private GaugeRepository gaugeRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        new GaugeTestData(jdbcTemplate, categoryRepository, sequenceRepository, gaugeRepository).reset();
    }

    /**
     * Test 1: prefix + zero-padded number + suffix, counter advances by one
     */
    @Test
    void testIdentifierFormat() {
        String first = transactions.write("test", () -> allocator.allocate(GaugeTestData.STANDARD, "set", SuffixPolicy.NONE));
        String second = transactions.write("test", () -> allocator.allocate(GaugeTestData.STANDARD, "set", SuffixPolicy.GO));
        String third = transactions.write("test", () -> allocator.allocate(GaugeTestData.STANDARD, "set", SuffixPolicy.NO_GO));

        assertEquals("SP0100", first);
        assertEquals("SP0101A", second);
        assertEquals("SP0102B", third);
        assertEquals(103L, sequenceRepository.findByCategoryIdAndSubType(GaugeTestData.STANDARD, "set")
            .orElseThrow().getNextValue());
    }

    /**
     * Test 2: A null sub-type uses the default sequence
     */
    @Test
    void testNullSubTypeUsesDefault() {
        String identifier = transactions.write("test", () -> allocator.allocate(GaugeTestData.CALIPER, null, SuffixPolicy.NONE));

        assertEquals("CA0001", identifier);
    }

    /**
     * Test 3: Unknown (category, sub-type) → ConfigurationException
     */
    @Test
    void testMissingSequenceIsConfigurationError() {
        assertThrows(ConfigurationException.class,
            () -> transactions.write("test", () -> allocator.allocate(GaugeTestData.STANDARD, "bogus", SuffixPolicy.NONE)));
    }

    /**
     * Test 4: Allocation must join an existing transaction
     */
    @Test
    void testAllocationOutsideTransactionIsRejected() {
        assertThrows(IllegalTransactionStateException.class,
            () -> allocator.allocate(GaugeTestData.STANDARD, "set", SuffixPolicy.NONE));
    }

    /**
     * Test 5: Numbers past 9999 widen instead of wrapping
     */
    @Test
    void testNumbersWidenPastFourDigits() {
        IdentifierSequence sequence = sequenceRepository.findByCategoryIdAndSubType(GaugeTestData.STANDARD, "set").orElseThrow();
        sequence.setNextValue(9999);
        sequenceRepository.save(sequence);

        String last = transactions.write("test", () -> allocator.allocate(GaugeTestData.STANDARD, "set", SuffixPolicy.NONE));
        String widened = transactions.write("test", () -> allocator.allocate(GaugeTestData.STANDARD, "set", SuffixPolicy.NONE));

        assertEquals("SP9999", last);
        assertEquals("SP10000", widened);
    }

    /**
     * Test 6: Peek shows the next identifier without consuming it
     */
    @Test
    void testPeekDoesNotConsume() {
        assertEquals("SP0100", allocator.peek(GaugeTestData.STANDARD, "set", SuffixPolicy.NONE));
        assertEquals("SP0100", allocator.peek(GaugeTestData.STANDARD, "set", SuffixPolicy.NONE));
        assertEquals("SP0100", transactions.write("test", () -> allocator.allocate(GaugeTestData.STANDARD, "set", SuffixPolicy.NONE)));
    }

    /**
     * Test 7: Thread-safety - concurrent allocations never collide
     *
     * 20 threads allocate 5 identifiers each. Every identifier must be distinct and
     * the counter must end exactly 100 numbers further.
     */
    @Test
    void testConcurrentAllocationsAreDistinct() throws Exception {
        int threads = 20;
        int perThread = 5;
        ExecutorService executor = Executors.newFixedThreadPool(threads);

        List<Callable<List<Long>>> tasks = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            tasks.add(() -> {
                List<Long> values = new ArrayList<>();
                for (int j = 0; j < perThread; j++) {
                    String id = transactions.write("test",
                        () -> allocator.allocate(GaugeTestData.STANDARD, "set", SuffixPolicy.NONE));
                    values.add(Long.parseLong(id.substring(2)));
                }
                return values;
            });
        }

        Set<Long> all = new HashSet<>();
        for (Future<List<Long>> future : executor.invokeAll(tasks)) {
            List<Long> values = future.get();
            for (int i = 1; i < values.size(); i++) {
                assertTrue(values.get(i) > values.get(i - 1), "values from one thread must increase");
            }
            all.addAll(values);
        }
        executor.shutdown();
        assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(threads * perThread, all.size());
        assertEquals(100L, all.stream().mapToLong(Long::longValue).min().orElseThrow());
        assertEquals(199L, all.stream().mapToLong(Long::longValue).max().orElseThrow());
        assertEquals(200L, sequenceRepository.findByCategoryIdAndSubType(GaugeTestData.STANDARD, "set")
            .orElseThrow().getNextValue());
    }
}
