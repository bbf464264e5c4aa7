package dao.tron.txverify.service;

import dao.tron.txverify.client.BatchContentStore;
import dao.tron.txverify.exception.InvalidHintException;
import dao.tron.txverify.exception.TransientCollaboratorException;
import dao.tron.txverify.model.BatchDescriptor;
import dao.tron.txverify.model.ErrorKind;
import dao.tron.txverify.model.Hash32;
import dao.tron.txverify.model.OperationKind;
import dao.tron.txverify.model.TransactionRecord;
import dao.tron.txverify.model.VerdictOutcome;
import dao.tron.txverify.model.VerificationHint;
import dao.tron.txverify.model.VerificationVerdict;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static dao.tron.txverify.service.BatchFixtures.HASHER;
import static dao.tron.txverify.service.BatchFixtures.TREE;
import static dao.tron.txverify.service.BatchFixtures.order;
import static dao.tron.txverify.service.BatchFixtures.orders;
import static org.junit.jupiter.api.Assertions.*;

class TransactionVerifierTest {

    private static final Instant AT_0955 = Instant.parse("2025-07-01T09:55:00Z");

    private BatchFixtures.Harness harness;
    private MerkleProofVerifier proofVerifier;

    @BeforeEach
    void setUp() {
        harness = new BatchFixtures.Harness();
        proofVerifier = new MerkleProofVerifier(BatchFixtures.ALGORITHM);
    }

    private static VerificationHint byBatch(String batchId) {
        return VerificationHint.builder().batchId(batchId).build();
    }

    @Test
    @DisplayName("Anchored record verifies against its batch root")
    void testVerified() {
        // Arrange
        BatchDescriptor batch = harness.anchor("BATCH-2025-07-01-abc123", AT_0955, orders(1, 5), true);

        // Act
        VerificationVerdict verdict = harness.verifier.verify(order(3), byBatch("BATCH-2025-07-01-abc123"));

        // Assert
        assertEquals(VerdictOutcome.VERIFIED, verdict.outcome(), verdict.reason());
        assertEquals("BATCH-2025-07-01-abc123", verdict.batchId());
        assertEquals(batch.merkleRoot(), verdict.expectedRoot());
        assertEquals(HASHER.digest(order(3)), verdict.leafHash());
        assertEquals(AT_0955, verdict.batchTimestamp());
        assertEquals(OperationKind.INSERT, verdict.operation());
        assertTrue(proofVerifier.verify(verdict.leafHash(), verdict.proof(), verdict.expectedRoot()),
                "returned proof must check independently");
    }

    @Test
    @DisplayName("Record verifies without hints and without stored proofs")
    void testVerifiedByRebuildingProof() {
        harness.anchor("BATCH-2025-06-30-a", AT_0955.minusSeconds(86_400), orders(100, 4), false);
        harness.anchor("BATCH-2025-07-01-b", AT_0955, orders(1, 7), false);

        VerificationVerdict verdict = harness.verifier.verify(order(7), null);

        assertEquals(VerdictOutcome.VERIFIED, verdict.outcome(), verdict.reason());
        assertEquals("BATCH-2025-07-01-b", verdict.batchId());
        assertEquals(6, verdict.proof().leafIndex());
    }

    @Test
    @DisplayName("Record absent from every batch in the window is NOT_FOUND")
    void testNotFound() {
        // Arrange
        harness.anchor("BATCH-2025-07-01-w1", AT_0955, orders(1, 4), true);
        harness.anchor("BATCH-2025-07-01-w2", AT_0955.plusSeconds(30), orders(10, 4), true);
        VerificationHint hint = VerificationHint.builder()
                .timeStart("2025-07-01T09:54:00Z")
                .timeEnd("2025-07-01T09:56:00Z")
                .build();

        // Act
        VerificationVerdict verdict = harness.verifier.verify(order(999), hint);

        // Assert
        assertEquals(VerdictOutcome.NOT_FOUND, verdict.outcome());
        assertEquals(List.of("BATCH-2025-07-01-w2", "BATCH-2025-07-01-w1"), verdict.candidates());
        assertTrue(verdict.reason().contains("no leaf matches"), verdict.reason());
        assertNull(verdict.batchId());
    }

    @Test
    @DisplayName("Unknown batch id is NOT_FOUND with no candidates")
    void testNotFoundUnknownBatch() {
        harness.anchor("BATCH-2025-07-01-abc123", AT_0955, orders(1, 2), true);

        VerificationVerdict verdict = harness.verifier.verify(order(1), byBatch("BATCH-2025-07-02-zzz"));

        assertEquals(VerdictOutcome.NOT_FOUND, verdict.outcome());
        assertTrue(verdict.candidates().isEmpty());
        assertTrue(verdict.reason().contains("not on the ledger"));
    }

    @Test
    @DisplayName("Empty hint and two batches holding the record at equal rank is AMBIGUOUS")
    void testAmbiguous() {
        // Arrange: the same record anchored twice
        List<TransactionRecord> first = List.of(order(1), order(2));
        List<TransactionRecord> second = List.of(order(3), order(1), order(4));
        harness.anchor("BATCH-2025-07-01-one", AT_0955, first, true);
        harness.anchor("BATCH-2025-07-01-two", AT_0955.plusSeconds(10), second, true);
        // Act
        VerificationVerdict verdict = harness.verifier.verify(order(1), VerificationHint.empty());

        // Assert
        assertEquals(VerdictOutcome.AMBIGUOUS, verdict.outcome());
        assertTrue(verdict.candidates().containsAll(List.of("BATCH-2025-07-01-one", "BATCH-2025-07-01-two")));
        assertNull(verdict.batchId());
    }

    @Test
    @DisplayName("Equal rank under a database and table hint is still AMBIGUOUS")
    void testAmbiguousWithHint() {
        harness.anchor("BATCH-2025-07-01-one", AT_0955, List.of(order(1), order(2)), true);
        harness.anchor("BATCH-2025-07-01-two", AT_0955.plusSeconds(10), List.of(order(1), order(3)), true);
        VerificationHint hint = VerificationHint.builder().databaseName("sales").tableName("orders").build();

        VerificationVerdict verdict = harness.verifier.verify(order(1), hint);

        assertEquals(VerdictOutcome.AMBIGUOUS, verdict.outcome());
        assertEquals(2, verdict.candidates().size());
    }

    @Test
    @DisplayName("Batch id hint resolves what would otherwise be ambiguous")
    void testDirectHintBreaksTie() {
        harness.anchor("BATCH-2025-07-01-one", AT_0955, List.of(order(1), order(2)), true);
        harness.anchor("BATCH-2025-07-01-two", AT_0955.plusSeconds(10), List.of(order(1), order(3)), true);

        VerificationVerdict verdict = harness.verifier.verify(order(1), byBatch("BATCH-2025-07-01-one"));

        assertEquals(VerdictOutcome.VERIFIED, verdict.outcome());
        assertEquals("BATCH-2025-07-01-one", verdict.batchId());
    }

    @Test
    @DisplayName("Leaf present but stored contents do not reach the ledger root is TAMPERED")
    void testTampered() {
        // Arrange: ledger root over the genuine leaves, stored contents with another leaf altered
        List<Hash32> genuine = BatchFixtures.leaves(orders(1, 4));
        BatchDescriptor batch = BatchFixtures.descriptor("BATCH-2025-07-01-t", AT_0955, "sales",
                List.of("orders"), TREE.computeRoot(genuine), 4);
        List<Hash32> altered = new ArrayList<>(genuine);
        altered.set(3, genuine.get(3).flipBit(0));
        harness.ledger.save(batch);
        harness.store.save(BatchFixtures.contents("BATCH-2025-07-01-t", altered, false));

        // Act
        VerificationVerdict verdict = harness.verifier.verify(order(1), byBatch("BATCH-2025-07-01-t"));

        // Assert
        assertEquals(VerdictOutcome.TAMPERED, verdict.outcome());
        assertEquals("BATCH-2025-07-01-t", verdict.batchId());
        assertEquals(batch.merkleRoot(), verdict.expectedRoot());
        assertNull(verdict.proof());
    }

    @Test
    @DisplayName("Stale cached root is re-read from the ledger before deciding")
    void testStaleRootReverified() {
        // Arrange: cache primed with a wrong root, ledger then corrected
        List<TransactionRecord> records = orders(1, 3);
        Hash32 realRoot = TREE.computeRoot(BatchFixtures.leaves(records));
        BatchDescriptor stale = BatchFixtures.descriptor("BATCH-2025-07-01-s", AT_0955, "sales",
                List.of("orders"), realRoot.flipBit(5), 3);
        harness.ledger.save(stale);
        harness.cache.get("BATCH-2025-07-01-s");
        BatchDescriptor current = harness.anchor("BATCH-2025-07-01-s", AT_0955, records, true);

        // Act
        VerificationVerdict verdict = harness.verifier.verify(order(2), byBatch("BATCH-2025-07-01-s"));

        // Assert
        assertEquals(VerdictOutcome.VERIFIED, verdict.outcome());
        assertEquals(current.merkleRoot(), verdict.expectedRoot());
        assertEquals(realRoot, harness.cache.get("BATCH-2025-07-01-s").orElseThrow().merkleRoot(),
                "stale entry must have been invalidated");
    }

    @Test
    @DisplayName("Missing stored contents is a non-retryable collaborator error")
    void testPermanentCollaboratorError() {
        harness.ledger.save(BatchFixtures.descriptor("BATCH-2025-07-01-x", AT_0955, "sales",
                List.of("orders"), Hash32.of(new byte[32]), 1));

        VerificationVerdict verdict = harness.verifier.verify(order(1), byBatch("BATCH-2025-07-01-x"));

        assertEquals(VerdictOutcome.ERROR, verdict.outcome());
        assertEquals(ErrorKind.COLLABORATOR, verdict.errorKind());
        assertFalse(verdict.retryable());
        assertNotNull(verdict.leafHash());
    }

    @Test
    @DisplayName("Unreachable storage is a retryable collaborator error")
    void testTransientCollaboratorError() {
        // Arrange
        harness.anchor("BATCH-2025-07-01-abc123", AT_0955, orders(1, 2), true);
        BatchContentStore down = batch -> {
            throw new TransientCollaboratorException("storage timeout");
        };
        TransactionVerifier verifier = new TransactionVerifier(HASHER, new HintResolver(), harness.search,
                harness.cache, harness.ledger, down, proofVerifier, TREE, new RetryPolicy(2, 0, 0, 0),
                harness.props);

        // Act
        VerificationVerdict verdict = verifier.verify(order(1), byBatch("BATCH-2025-07-01-abc123"));

        // Assert
        assertEquals(ErrorKind.COLLABORATOR, verdict.errorKind());
        assertTrue(verdict.retryable());
        assertTrue(verdict.reason().contains("storage timeout"));
    }

    @Test
    @DisplayName("Unsupported column type is an encoding error")
    void testEncodingError() {
        TransactionRecord record = TransactionRecord.builder()
                .databaseName("sales").tableName("orders").operation(OperationKind.INSERT)
                .column("created", LocalDateTime.of(2025, 7, 1, 9, 55))
                .build();

        VerificationVerdict verdict = harness.verifier.verify(record, null);

        assertEquals(ErrorKind.ENCODING, verdict.errorKind());
        assertNull(verdict.leafHash());
        assertEquals(0, harness.ledger.getIndexQueryCount(), "nothing looked up");
    }

    @Test
    @DisplayName("Malformed hint fails before any lookup")
    void testInvalidHintThrows() {
        VerificationHint hint = VerificationHint.builder().expectedOperation("MERGE").build();

        assertThrows(InvalidHintException.class, () -> harness.verifier.verify(order(1), hint));
        assertEquals(0, harness.ledger.getIndexQueryCount());
        assertEquals(0, harness.store.getFetchCount());
    }

    @Test
    @DisplayName("Verification progress only moves forward")
    void testProgressIsForwardOnly() {
        TransactionVerifier.Progress progress = new TransactionVerifier.Progress();

        progress.advance(TransactionVerifier.State.HINTS_RESOLVED);
        progress.advance(TransactionVerifier.State.BATCH_FETCHED);

        assertEquals(TransactionVerifier.State.BATCH_FETCHED, progress.current());
        assertThrows(IllegalStateException.class,
                () -> progress.advance(TransactionVerifier.State.CANDIDATES_FOUND));
        assertThrows(IllegalStateException.class,
                () -> progress.advance(TransactionVerifier.State.BATCH_FETCHED));
    }
}
