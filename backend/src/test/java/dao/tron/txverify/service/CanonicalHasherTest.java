package dao.tron.txverify.service;

import dao.tron.txverify.exception.EncodingException;
import dao.tron.txverify.model.Hash32;
import dao.tron.txverify.model.OperationKind;
import dao.tron.txverify.model.TransactionRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CanonicalHasherTest {

    private CanonicalHasher hasher;

    @BeforeEach
    void setUp() {
        hasher = new CanonicalHasher(HashAlgorithm.SHA256);
    }

    private static TransactionRecord.Builder base() {
        return TransactionRecord.builder()
                .databaseName("sales")
                .tableName("orders")
                .operation(OperationKind.INSERT);
    }

    @Test
    @DisplayName("Column insertion order does not change the digest")
    void testDigestIndependentOfColumnOrder() {
        // Arrange
        Map<String, Object> forward = new LinkedHashMap<>();
        forward.put("id", 7);
        forward.put("amount", new BigDecimal("99.95"));
        forward.put("customer", "acme");
        Map<String, Object> backward = new LinkedHashMap<>();
        backward.put("customer", "acme");
        backward.put("amount", new BigDecimal("99.95"));
        backward.put("id", 7);

        // Act
        Hash32 a = hasher.digest(base().columns(forward).build());
        Hash32 b = hasher.digest(base().columns(backward).build());

        // Assert
        assertEquals(a, b);
    }

    @Test
    @DisplayName("Integer, string, float and decimal of the same face value hash differently")
    void testValueTypesAreTagged() {
        Hash32 asInt = hasher.digest(base().column("v", 1).build());
        Hash32 asLong = hasher.digest(base().column("v", 1L).build());
        Hash32 asString = hasher.digest(base().column("v", "1").build());
        Hash32 asFloat = hasher.digest(base().column("v", 1.0d).build());
        Hash32 asDecimal = hasher.digest(base().column("v", new BigDecimal("1")).build());

        assertEquals(asInt, asLong, "integral widths share one encoding");
        assertNotEquals(asInt, asString);
        assertNotEquals(asInt, asFloat);
        assertNotEquals(asInt, asDecimal);
        assertNotEquals(asFloat, asDecimal);
        assertNotEquals(asString, asDecimal);
    }

    @Test
    @DisplayName("Null column differs from a missing column and from an empty string")
    void testNullIsDistinct() {
        Hash32 withNull = hasher.digest(base().column("note", null).build());
        Hash32 withEmpty = hasher.digest(base().column("note", "").build());
        Hash32 without = hasher.digest(base().build());

        assertNotEquals(withNull, withEmpty);
        assertNotEquals(withNull, without);
    }

    @Test
    @DisplayName("Decimals are normalized: 10.50 and 10.5 hash the same")
    void testDecimalNormalization() {
        Hash32 a = hasher.digest(base().column("amount", new BigDecimal("10.50")).build());
        Hash32 b = hasher.digest(base().column("amount", new BigDecimal("10.5")).build());

        assertEquals(a, b);
    }

    @Test
    @DisplayName("Equal instants in different offsets hash the same")
    void testTimestampsNormalizedToUtc() {
        Instant instant = Instant.parse("2025-07-01T09:55:00Z");
        Hash32 utc = hasher.digest(base().column("at", instant).build());
        Hash32 shifted = hasher.digest(base()
                .column("at", OffsetDateTime.ofInstant(instant, ZoneOffset.ofHours(3)))
                .build());

        assertEquals(utc, shifted);
    }

    @Test
    @DisplayName("Database, table and operation are part of the digest")
    void testEnvelopeFieldsAreHashed() {
        Hash32 reference = hasher.digest(base().column("id", 1).build());

        assertNotEquals(reference, hasher.digest(base().databaseName("billing").column("id", 1).build()));
        assertNotEquals(reference, hasher.digest(base().tableName("refunds").column("id", 1).build()));
        assertNotEquals(reference, hasher.digest(base().operation(OperationKind.DELETE).column("id", 1).build()));
    }

    @Test
    @DisplayName("Local timestamp is informational and not hashed")
    void testLocalTimestampIgnored() {
        Hash32 without = hasher.digest(base().column("id", 1).build());
        Hash32 with = hasher.digest(base().column("id", 1)
                .localTimestamp(Instant.parse("2025-07-01T10:00:00Z")).build());

        assertEquals(without, with);
    }

    @Test
    @DisplayName("Timestamp without an offset is rejected")
    void testNaiveTimestampRejected() {
        TransactionRecord record = base().column("at", LocalDateTime.of(2025, 7, 1, 9, 55)).build();

        EncodingException ex = assertThrows(EncodingException.class, () -> hasher.digest(record));
        assertTrue(ex.getMessage().contains("'at'"), ex.getMessage());
    }

    @Test
    @DisplayName("Encoding starts with the versioned magic prefix")
    void testEncodingPrefix() {
        byte[] encoded = hasher.encode(base().build());

        assertEquals('T', encoded[0]);
        assertEquals('C', encoded[4]);
        assertEquals(CanonicalHasher.VERSION, encoded[5]);
    }

    @Test
    @DisplayName("SHA-256 and Keccak-256 give different digests for the same record")
    void testAlgorithmMatters() {
        TransactionRecord record = base().column("id", 1).build();

        Hash32 sha = hasher.digest(record);
        Hash32 keccak = new CanonicalHasher(HashAlgorithm.KECCAK256).digest(record);

        assertNotEquals(sha, keccak);
    }
}
