package dao.tron.txverify.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BatchContentsJsonTest {

    private static final String H1 = "0x" + "01".repeat(32);
    private static final String H2 = "0x" + "02".repeat(32);

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("Stored payload parses with proofs and is ordered by leaf index")
    void testParsesStoredPayload() throws Exception {
        String json = "{\"batch_id\":\"BATCH-2025-07-01-abc123\",\"merkle_root\":\"" + H1 + "\","
                + "\"leaves\":["
                + "{\"index\":1,\"hash\":\"" + H2 + "\"},"
                + "{\"index\":0,\"hash\":\"" + H1 + "\",\"operation\":\"UPDATE\",\"table\":\"orders\","
                + "\"proof\":{\"leaf_index\":0,\"steps\":[{\"hash\":\"" + H2 + "\",\"side\":\"RIGHT\"}]}}"
                + "]}";

        BatchContents contents = mapper.readValue(json, BatchContents.class);

        assertEquals(List.of(Hash32.fromHex(H1), Hash32.fromHex(H2)), contents.leafHashes());
        LeafEntry first = contents.leaves().get(0);
        assertEquals(OperationKind.UPDATE, first.operation());
        assertEquals(List.of(ProofStep.of(Hash32.fromHex(H2), Side.RIGHT)), first.proof().steps());
        assertTrue(contents.containsLeaf(Hash32.fromHex(H2)));
        assertNull(contents.leaves().get(1).proof());
    }

    @Test
    @DisplayName("Proof step with a short sibling is kept for the verifier to reject")
    void testShortSiblingKept() throws Exception {
        ProofStep step = mapper.readValue("{\"hash\":\"0xabcd\",\"side\":\"LEFT\"}", ProofStep.class);

        assertEquals(2, step.getSibling().length);
        assertEquals(Side.LEFT, step.getSide());
    }

    @Test
    @DisplayName("Hash writes as 0x-prefixed lowercase hex")
    void testHashSerialization() throws Exception {
        Hash32 hash = Hash32.fromHex("AB".repeat(32));

        assertEquals("\"0x" + "ab".repeat(32) + "\"", mapper.writeValueAsString(hash));
    }

    @Test
    @DisplayName("Batch ids carry a valid calendar date")
    void testBatchIdParsing() {
        assertEquals(LocalDate.of(2025, 7, 1), BatchId.parse("BATCH-2025-07-01-abc123").date());
        assertTrue(BatchId.tryParse("BATCH-2025-02-30-x").isEmpty());
        assertTrue(BatchId.tryParse("batch-2025-07-01-x").isEmpty());
        assertTrue(BatchId.tryParse("BATCH-2025-07-01-").isEmpty());
        assertThrows(IllegalArgumentException.class, () -> BatchId.parse("nope"));
    }
}
