package dao.tron.txverify.service;

import dao.tron.txverify.exception.EncodingException;
import dao.tron.txverify.model.Hash32;
import dao.tron.txverify.model.TransactionRecord;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Date;
import java.util.Map;

/**
 * Derives the content digest of a {@link TransactionRecord}.
 *
 * Encoding (version 1), all integers big-endian:
 * <pre>
 *   "TXREC" | 0x01 | str(database) | str(table) | str(operation) | u32(columnCount)
 *   then per column, sorted by name: str(name) | tag | payload
 * </pre>
 * {@code str} is a u32 byte length followed by UTF-8. Value tags keep integer 1, float 1.0,
 * decimal 1 and string "1" apart.
 */
@Service
public class CanonicalHasher {

    static final byte[] MAGIC = "TXREC".getBytes(StandardCharsets.US_ASCII);
    static final byte VERSION = 1;

    static final byte TAG_NULL = 0x00;
    static final byte TAG_BOOL = 0x01;
    static final byte TAG_INT = 0x02;
    static final byte TAG_FLOAT = 0x03;
    static final byte TAG_DECIMAL = 0x04;
    static final byte TAG_STRING = 0x05;
    static final byte TAG_TIMESTAMP = 0x06;

    private final HashAlgorithm algorithm;

    public CanonicalHasher(HashAlgorithm algorithm) {
        this.algorithm = algorithm;
    }

    public Hash32 digest(TransactionRecord record) {
        return Hash32.of(algorithm.digest(encode(record)));
    }

    /**
     * Canonical byte form of the record; what {@link #digest} hashes.
     *
     * @throws EncodingException if a column holds an unsupported type
     */
    public byte[] encode(TransactionRecord record) {
        Encoder out = new Encoder();
        out.raw(MAGIC);
        out.raw(new byte[]{VERSION});
        out.string(record.getDatabaseName());
        out.string(record.getTableName());
        out.string(record.getOperation().name());
        out.u32(record.getColumns().size());
        // getColumns() is a SortedMap: iteration is by name
        for (Map.Entry<String, Object> column : record.getColumns().entrySet()) {
            out.string(column.getKey());
            writeValue(out, column.getKey(), column.getValue());
        }
        return out.toByteArray();
    }

    private static void writeValue(Encoder out, String column, Object value) {
        if (value == null) {
            out.tag(TAG_NULL);
        } else if (value instanceof Boolean) {
            out.tag(TAG_BOOL);
            out.raw(new byte[]{(byte) (((Boolean) value) ? 1 : 0)});
        } else if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long) {
            out.tag(TAG_INT);
            out.bytes(BigInteger.valueOf(((Number) value).longValue()).toByteArray());
        } else if (value instanceof BigInteger) {
            out.tag(TAG_INT);
            out.bytes(((BigInteger) value).toByteArray());
        } else if (value instanceof Float || value instanceof Double) {
            out.tag(TAG_FLOAT);
            out.u64(Double.doubleToLongBits(((Number) value).doubleValue()));
        } else if (value instanceof BigDecimal) {
            BigDecimal normalized = ((BigDecimal) value).stripTrailingZeros();
            out.tag(TAG_DECIMAL);
            out.bytes(normalized.unscaledValue().toByteArray());
            out.u32(normalized.scale());
        } else if (value instanceof CharSequence) {
            out.tag(TAG_STRING);
            out.string(value.toString());
        } else if (value instanceof Instant || value instanceof OffsetDateTime
                || value instanceof ZonedDateTime || value instanceof Date) {
            Instant instant = toInstant(value);
            out.tag(TAG_TIMESTAMP);
            out.u64(instant.getEpochSecond());
            out.u32(instant.getNano());
        } else {
            throw new EncodingException("Unsupported value type " + value.getClass().getName()
                    + " for column '" + column + "'");
        }
    }

    private static Instant toInstant(Object value) {
        if (value instanceof Instant) return (Instant) value;
        if (value instanceof OffsetDateTime) return ((OffsetDateTime) value).toInstant();
        if (value instanceof ZonedDateTime) return ((ZonedDateTime) value).toInstant();
        // java.sql.Date does not support toInstant()
        return Instant.ofEpochMilli(((Date) value).getTime());
    }

    private static final class Encoder {
        private final ByteArrayOutputStream buf = new ByteArrayOutputStream(256);

        void raw(byte[] b) {
            buf.write(b, 0, b.length);
        }

        void tag(byte t) {
            buf.write(t);
        }

        void u32(int v) {
            buf.write(v >>> 24);
            buf.write(v >>> 16);
            buf.write(v >>> 8);
            buf.write(v);
        }

        void u64(long v) {
            u32((int) (v >>> 32));
            u32((int) v);
        }

        void bytes(byte[] b) {
            u32(b.length);
            raw(b);
        }

        void string(String s) {
            bytes(s.getBytes(StandardCharsets.UTF_8));
        }

        byte[] toByteArray() {
            return buf.toByteArray();
        }
    }
}
