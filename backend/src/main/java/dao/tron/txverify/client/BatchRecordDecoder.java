package dao.tron.txverify.client;

import dao.tron.txverify.model.BatchDescriptor;
import dao.tron.txverify.model.Hash32;
import dao.tron.txverify.model.OperationKind;
import org.tron.trident.abi.FunctionReturnDecoder;
import org.tron.trident.abi.TypeReference;
import org.tron.trident.abi.datatypes.Type;
import org.tron.trident.abi.datatypes.Utf8String;
import org.tron.trident.abi.datatypes.generated.Bytes32;
import org.tron.trident.abi.datatypes.generated.Uint256;
import org.tron.trident.abi.datatypes.generated.Uint32;
import org.tron.trident.abi.datatypes.generated.Uint64;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * ABI decoding for the audit ledger contract's read functions.
 *
 * Batch record layout returned by {@code getBatchAt(uint256)} and {@code getBatchById(string)}:
 * <pre>
 * 0: string  batchId        (empty when the batch does not exist)
 * 1: bytes32 merkleRoot
 * 2: uint64  timestamp      (seconds since epoch, block time of anchoring)
 * 3: string  databaseName
 * 4: string  tableNames     (comma separated)
 * 5: uint32  txCount
 * 6: string  storageRef
 * 7: uint32  insertCount
 * 8: uint32  updateCount
 * 9: uint32  deleteCount
 * </pre>
 * A record whose three operation counts are all zero has no declared counts.
 */
public final class BatchRecordDecoder {
    private BatchRecordDecoder() {}

    public static final int BATCH_FIELDS = 10;

    public static List<TypeReference<?>> batchOutputs() {
        return Arrays.asList(
                new TypeReference<Utf8String>() {},
                new TypeReference<Bytes32>() {},
                new TypeReference<Uint64>() {},
                new TypeReference<Utf8String>() {},
                new TypeReference<Utf8String>() {},
                new TypeReference<Uint32>() {},
                new TypeReference<Utf8String>() {},
                new TypeReference<Uint32>() {},
                new TypeReference<Uint32>() {},
                new TypeReference<Uint32>() {}
        );
    }

    /**
     * @return empty when the contract reports no batch (blank id)
     * @throws IllegalStateException when the output has an unexpected shape
     */
    public static Optional<BatchDescriptor> decodeBatch(String resultHex) {
        List<Type<?>> decoded = decodeAbi(resultHex, batchOutputs());
        requireDecodedSize(decoded, BATCH_FIELDS);

        String batchId = ((Utf8String) decoded.get(0)).getValue();
        if (batchId == null || batchId.isBlank()) {
            return Optional.empty();
        }
        Bytes32 root = (Bytes32) decoded.get(1);
        Uint64 timestamp = (Uint64) decoded.get(2);
        String databaseName = ((Utf8String) decoded.get(3)).getValue();
        String tableNames = ((Utf8String) decoded.get(4)).getValue();
        Uint32 txCount = (Uint32) decoded.get(5);
        String storageRef = ((Utf8String) decoded.get(6)).getValue();

        Map<OperationKind, Integer> counts = new EnumMap<>(OperationKind.class);
        int inserts = ((Uint32) decoded.get(7)).getValue().intValue();
        int updates = ((Uint32) decoded.get(8)).getValue().intValue();
        int deletes = ((Uint32) decoded.get(9)).getValue().intValue();
        if (inserts + updates + deletes > 0) {
            counts.put(OperationKind.INSERT, inserts);
            counts.put(OperationKind.UPDATE, updates);
            counts.put(OperationKind.DELETE, deletes);
        }

        return Optional.of(new BatchDescriptor(
                batchId,
                Hash32.of(root.getValue()),
                Instant.ofEpochSecond(timestamp.getValue().longValue()),
                databaseName,
                splitTables(tableNames),
                txCount.getValue().intValue(),
                storageRef,
                counts
        ));
    }

    public static List<TypeReference<?>> rootOutputs() {
        return List.of(new TypeReference<Bytes32>() {});
    }

    /**
     * Decodes {@code getBatchRoot(string) returns (bytes32)}; an all-zero root means unknown batch.
     */
    public static Optional<Hash32> decodeRoot(String resultHex) {
        List<Type<?>> decoded = decodeAbi(resultHex, rootOutputs());
        requireDecodedSize(decoded, 1);
        byte[] root = ((Bytes32) decoded.get(0)).getValue();
        for (byte b : root) {
            if (b != 0) return Optional.of(Hash32.of(root));
        }
        return Optional.empty();
    }

    public static List<TypeReference<?>> countOutputs() {
        return List.of(new TypeReference<Uint256>() {});
    }

    public static long decodeCount(String resultHex) {
        List<Type<?>> decoded = decodeAbi(resultHex, countOutputs());
        requireDecodedSize(decoded, 1);
        return ((Uint256) decoded.get(0)).getValue().longValueExact();
    }

    static List<String> splitTables(String joined) {
        List<String> tables = new ArrayList<>();
        if (joined == null) return tables;
        for (String part : joined.split(",")) {
            String t = part.trim();
            if (!t.isEmpty()) tables.add(t);
        }
        return tables;
    }

    private static void requireDecodedSize(List<?> decoded, int expected) {
        if (decoded.size() != expected) {
            throw new IllegalStateException("Unexpected decoded outputs=" + decoded.size() + ", expected=" + expected);
        }
    }

    private static List<Type<?>> decodeAbi(String resultHex, List<TypeReference<?>> outputs) {
        String hex = (resultHex.startsWith("0x") || resultHex.startsWith("0X")) ? resultHex : "0x" + resultHex;

        @SuppressWarnings({"rawtypes", "unchecked"})
        List<TypeReference<Type>> typed = (List) outputs;

        @SuppressWarnings({"rawtypes", "unchecked"})
        List<Type<?>> decoded = (List) FunctionReturnDecoder.decode(hex, typed);
        return decoded;
    }
}
