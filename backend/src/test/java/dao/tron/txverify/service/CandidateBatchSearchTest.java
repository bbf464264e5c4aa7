package dao.tron.txverify.service;

import dao.tron.txverify.model.BatchDescriptor;
import dao.tron.txverify.model.BatchId;
import dao.tron.txverify.model.BatchIndexFilter;
import dao.tron.txverify.model.BatchListQuery;
import dao.tron.txverify.model.BatchOrder;
import dao.tron.txverify.model.BatchPage;
import dao.tron.txverify.model.CandidateSet;
import dao.tron.txverify.model.Hash32;
import dao.tron.txverify.model.OperationKind;
import dao.tron.txverify.model.ResolvedConstraint;
import dao.tron.txverify.model.ScoredCandidate;
import dao.tron.txverify.model.TimeRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static dao.tron.txverify.service.BatchFixtures.descriptor;
import static org.junit.jupiter.api.Assertions.*;

class CandidateBatchSearchTest {

    private static final Instant T0 = Instant.parse("2025-07-01T09:00:00Z");
    private static final Hash32 ROOT = Hash32.of(new byte[32]);

    private BatchFixtures.Harness harness;

    @BeforeEach
    void setUp() {
        harness = new BatchFixtures.Harness();
    }

    private BatchDescriptor save(String id, int minute, String db, String... tables) {
        BatchDescriptor batch = descriptor(id, T0.plusSeconds(60L * minute), db, List.of(tables), ROOT, 3);
        harness.ledger.save(batch);
        return batch;
    }

    private static ResolvedConstraint constraint(String db, String table, TimeRange range, OperationKind op) {
        return new ResolvedConstraint(null, db, table, range, op);
    }

    @Test
    @DisplayName("Narrower constraint never yields more candidates")
    void testMonotoneInConstraint() {
        // Arrange: 12 sales batches, 6 billing batches
        for (int i = 0; i < 12; i++) save("BATCH-2025-07-01-s" + i, i, "sales", "orders");
        for (int i = 0; i < 6; i++) save("BATCH-2025-07-01-b" + i, 20 + i, "billing", "invoices");

        ResolvedConstraint wide = ResolvedConstraint.UNCONSTRAINED;
        ResolvedConstraint narrow = constraint("sales", null, null, null);
        ResolvedConstraint narrower = constraint("sales", "orders",
                TimeRange.between(T0, T0.plusSeconds(60L * 5)), null);

        // Act + Assert, for several cost bounds
        for (int max : new int[]{1, 4, 10, 50}) {
            CandidateSet w = harness.search.search(wide, max);
            CandidateSet n = harness.search.search(narrow, max);
            CandidateSet nn = harness.search.search(narrower, max);

            assertTrue(n.size() <= w.size(), "max " + max);
            assertTrue(nn.size() <= n.size(), "max " + max);
            assertTrue(w.size() <= max);
            n.candidates().forEach(c -> assertEquals("sales", c.batch().databaseName()));
            // a sales batch ranked under the wide constraint stays a candidate under the narrow one
            w.candidates().stream()
                    .filter(c -> c.batch().databaseName().equals("sales"))
                    .forEach(c -> assertTrue(n.ids().contains(c.batchId()), c.batchId() + " at max " + max));
        }
    }

    @Test
    @DisplayName("Truncation keeps the most recent batches and flags the result")
    void testTruncationByRecency() {
        for (int i = 0; i < 5; i++) save("BATCH-2025-07-01-s" + i, i, "sales", "orders");

        CandidateSet result = harness.search.search(constraint("sales", null, null, null), 3);

        assertTrue(result.possiblyIncomplete());
        assertEquals(List.of("BATCH-2025-07-01-s4", "BATCH-2025-07-01-s3", "BATCH-2025-07-01-s2"), result.ids());

        CandidateSet exact = harness.search.search(constraint("sales", null, null, null), 5);
        assertFalse(exact.possiblyIncomplete());
    }

    @Test
    @DisplayName("Higher score ranks first; equal scores go to the more recent batch")
    void testRankingOrder() {
        // Arrange
        save("BATCH-2025-07-01-old", 1, "sales", "orders");
        save("BATCH-2025-07-01-mixed", 2, "sales", "orders", "refunds");
        save("BATCH-2025-07-01-new", 3, "sales", "orders");

        // Act
        CandidateSet result = harness.search.search(constraint("sales", "orders", null, null));

        // Assert: sole-table batches (70) before the mixed one (65), newest first on ties
        assertEquals(List.of("BATCH-2025-07-01-new", "BATCH-2025-07-01-old", "BATCH-2025-07-01-mixed"), result.ids());
        assertEquals(List.of(70, 70, 65), result.candidates().stream().map(ScoredCandidate::score).toList());
    }

    @Test
    @DisplayName("Score points per matched hint field")
    void testScoring() {
        BatchDescriptor declared = new BatchDescriptor("BATCH-2025-07-01-d", ROOT, T0.plusSeconds(30), "Sales",
                List.of("orders", "Refunds"), 4, "ref", Map.of(OperationKind.UPDATE, 4));
        BatchDescriptor undeclared = descriptor("BATCH-2025-07-01-u", T0, "sales", List.of("orders"), ROOT, 2);
        BatchDescriptor bare = new BatchDescriptor("BATCH-2025-07-01-b", ROOT, T0, "sales",
                List.of("orders"), 2, "ref", Map.of());
        TimeRange window = TimeRange.between(T0, T0.plusSeconds(60));

        ScoredCandidate a = harness.search.score(declared, constraint("sales", "refunds", window, OperationKind.UPDATE));
        ScoredCandidate b = harness.search.score(undeclared, constraint("sales", "orders", null, OperationKind.DELETE));
        ScoredCandidate c = harness.search.score(bare, constraint(null, null, null, OperationKind.DELETE));

        assertEquals(CandidateBatchSearch.DATABASE_IGNORE_CASE + CandidateBatchSearch.TABLE_CONTAINED_IGNORE_CASE
                + CandidateBatchSearch.IN_TIME_WINDOW + CandidateBatchSearch.OPERATION_DECLARED, a.score());
        assertEquals(4, a.matchReasons().size());
        assertEquals(CandidateBatchSearch.DATABASE_EXACT + CandidateBatchSearch.TABLE_SOLE_EXACT, b.score(),
                "declared counts without DELETE earn nothing for the operation");
        assertEquals(CandidateBatchSearch.OPERATION_PLAUSIBLE, c.score());
    }

    @Test
    @DisplayName("Batch id takes the direct path")
    void testDirectLookup() {
        save("BATCH-2025-07-01-abc123", 1, "sales", "orders");
        save("BATCH-2025-07-01-other", 2, "sales", "orders");

        CandidateSet hit = harness.search.search(new ResolvedConstraint(
                BatchId.parse("BATCH-2025-07-01-abc123"), "sales", null, null, null));
        CandidateSet miss = harness.search.search(new ResolvedConstraint(
                BatchId.parse("BATCH-2025-07-01-missing"), null, null, null, null));

        assertTrue(hit.directLookup());
        assertEquals(List.of("BATCH-2025-07-01-abc123"), hit.ids());
        assertEquals("batch id match", hit.candidates().get(0).matchReasons().get(0));
        assertTrue(miss.directLookup());
        assertTrue(miss.isEmpty());
    }

    @Test
    @DisplayName("Listing filters, orders and pages batches")
    void testListPaging() {
        // Arrange
        for (int i = 0; i < 5; i++) save("BATCH-2025-07-01-s" + i, i, "sales", "orders");
        save("BATCH-2025-07-01-b0", 9, "billing", "invoices");
        BatchIndexFilter salesOnly = new BatchIndexFilter(null, "SALES", null, null, null, null, 0);

        // Act
        BatchPage first = harness.search.list(new BatchListQuery(salesOnly, 2, 0, BatchOrder.TIMESTAMP_DESC));
        BatchPage last = harness.search.list(new BatchListQuery(salesOnly, 2, 4, BatchOrder.TIMESTAMP_DESC));
        BatchPage oldest = harness.search.list(new BatchListQuery(salesOnly, 1, 0, BatchOrder.TIMESTAMP_ASC));

        // Assert
        assertEquals(5, first.totalCount());
        assertTrue(first.hasMore());
        assertEquals(List.of("BATCH-2025-07-01-s4", "BATCH-2025-07-01-s3"),
                first.batches().stream().map(BatchDescriptor::batchId).toList());
        assertEquals(1, last.batches().size());
        assertFalse(last.hasMore());
        assertEquals("BATCH-2025-07-01-s0", oldest.batches().get(0).batchId());
    }
}
