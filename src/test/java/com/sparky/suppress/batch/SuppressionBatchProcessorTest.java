package com.sparky.suppress.batch;

import com.sparky.suppress.action.ISuppressionAction;
import com.sparky.suppress.action.NoOpAction;
import com.sparky.suppress.csv.CsvRow;
import com.sparky.suppress.csv.CsvRowNormalizer;
import com.sparky.suppress.csv.InvalidSuppressionFileException;
import com.sparky.suppress.csv.SuppressionRecordSource;
import com.sparky.suppress.model.SuppressionRecord;
import com.sparky.suppress.model.SuppressionType;
import com.sparky.suppress.util.SuppressionMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class SuppressionBatchProcessorTest {

    private SimpleMeterRegistry registry;
    private SuppressionMetrics metrics;
    private CsvRowNormalizer normalizer;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new SuppressionMetrics(registry);
        normalizer = new CsvRowNormalizer(SuppressionType.NON_TRANSACTIONAL, null);
    }

    private SuppressionRecordSource source(String... lines) {
        List<CsvRow> rows = new ArrayList<>();
        for (int i = 0; i < lines.length; i++) {
            rows.add(new CsvRow(i + 1, List.of(lines[i].split(",", -1))));
        }
        return new SuppressionRecordSource(rows, normalizer);
    }

    @SuppressWarnings("unchecked")
    private static ArgumentCaptor<List<SuppressionRecord>> batchCaptor() {
        return ArgumentCaptor.forClass(List.class);
    }

    // ==================== counting tests ====================

    @Test
    void testProcess_caseInsensitiveDuplicatesCountedOnce() throws InvalidSuppressionFileException {
        SuppressionBatchProcessor processor = new SuppressionBatchProcessor(10, metrics);

        RunSummary summary = processor.process(source("recipient", "a@example.com", "A@EXAMPLE.com"), new NoOpAction());

        assertEquals(2, summary.getAddrsChecked());
        assertEquals(1, summary.getGoodRecips());
        assertEquals(1, summary.getDuplicateRecips());
        assertEquals(0, summary.getBadRecips());
        assertEquals(0, summary.getDoneRecips());
    }

    @Test
    void testProcess_sameRecipientDifferentTypeIsNotDuplicate() throws InvalidSuppressionFileException {
        SuppressionBatchProcessor processor = new SuppressionBatchProcessor(10, metrics);

        RunSummary summary = processor.process(source(
            "recipient,type",
            "a@example.com,transactional",
            "a@example.com,non_transactional"), new NoOpAction());

        assertEquals(2, summary.getGoodRecips());
        assertEquals(0, summary.getDuplicateRecips());
    }

    @Test
    void testProcess_countsAddUp() throws InvalidSuppressionFileException {
        SuppressionBatchProcessor processor = new SuppressionBatchProcessor(2, metrics);

        RunSummary summary = processor.process(source(
            "recipient,type",
            "a@example.com,transactional",
            "bad-address,transactional",
            "b@example.com,",
            "a@example.com,transactional",
            "c@example.com,non_transactional"), new NoOpAction());

        assertEquals(5, summary.getAddrsChecked());
        assertEquals(summary.getAddrsChecked(),
            summary.getGoodRecips() + summary.getBadRecips() + summary.getDuplicateRecips());
        assertEquals(3, summary.getGoodRecips());
        assertEquals(1, summary.getBadRecips());
        assertEquals(1, summary.getDuplicateRecips());
        assertEquals(4, summary.getFlagsGood());
        assertEquals(1, summary.getFlagsDefaulted());
        assertEquals(5.0, registry.get("suppression_records_processed_total").counter().count());
    }

    // ==================== batching tests ====================

    @Test
    void testProcess_flushesFullBatchesAndTrailingBatch() throws InvalidSuppressionFileException {
        ISuppressionAction action = mock(ISuppressionAction.class);
        when(action.name()).thenReturn("update");
        when(action.apply(anyList())).thenAnswer(inv -> ((List<?>) inv.getArgument(0)).size());
        SuppressionBatchProcessor processor = new SuppressionBatchProcessor(2, metrics);

        RunSummary summary = processor.process(source(
            "recipient",
            "a@example.com",
            "b@example.com",
            "c@example.com",
            "d@example.com",
            "e@example.com"), action);

        ArgumentCaptor<List<SuppressionRecord>> captor = batchCaptor();
        verify(action, times(3)).apply(captor.capture());
        List<List<SuppressionRecord>> batches = captor.getAllValues();
        assertEquals(2, batches.get(0).size());
        assertEquals(2, batches.get(1).size());
        assertEquals(1, batches.get(2).size());
        assertEquals("a@example.com", batches.get(0).get(0).recipient());
        assertEquals("e@example.com", batches.get(2).get(0).recipient());
        assertEquals(5, summary.getDoneRecips());
        assertEquals(5.0, registry.get("suppression_entries_transacted_total").counter().count());
    }

    @Test
    void testProcess_noGoodRowsMeansNoAction() throws InvalidSuppressionFileException {
        ISuppressionAction action = mock(ISuppressionAction.class);
        SuppressionBatchProcessor processor = new SuppressionBatchProcessor(2, metrics);

        RunSummary summary = processor.process(source("recipient", "not-valid", "also@invalid"), action);

        verify(action, never()).apply(anyList());
        assertEquals(2, summary.getBadRecips());
    }

    @Test
    void testProcess_doneIsWhatTheActionReports() throws InvalidSuppressionFileException {
        ISuppressionAction action = mock(ISuppressionAction.class);
        when(action.name()).thenReturn("delete");
        when(action.apply(anyList())).thenReturn(1);
        SuppressionBatchProcessor processor = new SuppressionBatchProcessor(3, metrics);

        RunSummary summary = processor.process(source("recipient", "a@example.com", "b@example.com", "c@example.com", "d@example.com"), action);

        assertEquals(4, summary.getGoodRecips());
        assertEquals(2, summary.getDoneRecips());
    }

    @Test
    void testProcess_malformedRowAbortsRun() {
        SuppressionBatchProcessor processor = new SuppressionBatchProcessor(2, metrics);

        assertThrows(InvalidSuppressionFileException.class,
            () -> processor.process(source("recipient,type", "a@example.com"), new NoOpAction()));
    }

    @Test
    void testConstructor_rejectsNonPositiveBatchSize() {
        assertThrows(IllegalArgumentException.class, () -> new SuppressionBatchProcessor(0, metrics));
    }

    @Test
    void testSummary_json() {
        RunSummary summary = new RunSummary(5, 3, 1, 1, 3, 4, 1, 1500);

        assertEquals(5, summary.toJson().getLong("addrsChecked"));
        assertEquals(3, summary.toJson().getLong("doneRecips"));
        assertTrue(summary.toString().startsWith("Checked 5 email addresses in 1.50 seconds"));
    }
}
