package dao.tron.txverify.client;

import dao.tron.txverify.config.LedgerProperties;
import dao.tron.txverify.exception.CollaboratorException;
import dao.tron.txverify.exception.TransientCollaboratorException;
import dao.tron.txverify.exception.VerificationCancelledException;
import dao.tron.txverify.model.BatchDescriptor;
import dao.tron.txverify.model.BatchIndexFilter;
import dao.tron.txverify.model.Hash32;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.tron.trident.abi.FunctionEncoder;
import org.tron.trident.abi.datatypes.Function;
import org.tron.trident.abi.datatypes.Type;
import org.tron.trident.abi.datatypes.Utf8String;
import org.tron.trident.abi.datatypes.generated.Uint256;
import org.tron.trident.core.ApiWrapper;
import org.tron.trident.core.NodeType;
import org.tron.trident.core.key.KeyPair;
import org.tron.trident.proto.Response;
import org.tron.trident.utils.Numeric;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Reads the audit ledger contract through a TRON solidity node. Constant calls only; nothing is
 * signed or broadcast.
 *
 * The index query walks batches newest to oldest with {@code getBatchAt}, stopping at the
 * filter's limit, at the start of its time range (anchoring order is time order) or after
 * {@code ledger.max-scan} batches.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "ledger", name = "mode", havingValue = "tron", matchIfMissing = true)
public class AuditLedgerClientTrident implements LedgerClient {

    private final ApiWrapper wrapper;
    @Getter
    private final String callerAddress;
    @Getter
    private final String contractAddress;
    @Getter
    private final String network;
    private final int maxScan;

    public AuditLedgerClientTrident(LedgerProperties props) {
        this.contractAddress = props.getContractAddress();
        this.network = props.getNetwork() == null ? "nile" : props.getNetwork().toLowerCase(Locale.ROOT);
        this.maxScan = Math.max(1, props.getMaxScan());

        String privateKey = props.getPrivateKey();
        if (privateKey == null || privateKey.isBlank()) {
            // constant calls still need an owner address
            privateKey = KeyPair.generate().toPrivateKey();
            log.info("No ledger private key configured, using a generated read-only identity");
        } else if (privateKey.length() % 2 != 0) {
            throw new IllegalArgumentException("Invalid ledger private key: odd-length hex string");
        }

        this.wrapper = createWrapper(props, privateKey);
        this.callerAddress = wrapper.keyPair.toBase58CheckAddress();

        if (contractAddress == null || contractAddress.isBlank()) {
            log.warn("ledger.contract-address is not set; ledger calls will fail until it is configured");
        }
        log.info("AuditLedgerClientTrident initialized: network={}, contract={}, caller={}",
                network, contractAddress, callerAddress);
    }

    private ApiWrapper createWrapper(LedgerProperties props, String privateKey) {
        switch (network) {
            case "nile":
                return ApiWrapper.ofNile(privateKey);
            case "shasta":
                return ApiWrapper.ofShasta(privateKey);
            case "mainnet":
                if (props.getApiKey() == null || props.getApiKey().isBlank()) {
                    throw new IllegalArgumentException("ledger.api-key is required for mainnet");
                }
                return ApiWrapper.ofMainnet(privateKey, props.getApiKey());
            case "custom":
                if (props.getNodeEndpoint() == null || props.getSolidityEndpoint() == null) {
                    throw new IllegalArgumentException(
                            "ledger.node-endpoint and ledger.solidity-endpoint are required for network=custom");
                }
                return new ApiWrapper(props.getNodeEndpoint(), props.getSolidityEndpoint(), privateKey);
            default:
                throw new IllegalArgumentException("Unknown ledger.network: " + props.getNetwork());
        }
    }

    @Override
    public List<BatchDescriptor> queryBatchIndex(BatchIndexFilter filter) {
        if (filter.batchId() != null) {
            return getBatchById(filter.batchId())
                    .filter(filter::matches)
                    .map(List::of)
                    .orElse(List.of());
        }

        long count = countBatches();
        long floor = Math.max(0, count - maxScan);
        List<BatchDescriptor> result = new ArrayList<>();
        boolean stoppedEarly = false;

        for (long i = count - 1; i >= floor; i--) {
            if (Thread.currentThread().isInterrupted()) {
                throw new VerificationCancelledException("Index scan interrupted at position " + i);
            }
            Optional<BatchDescriptor> batch = getBatchAt(i);
            if (batch.isEmpty()) continue;
            BatchDescriptor b = batch.get();
            if (filter.timeRange() != null && filter.timeRange().start() != null
                    && b.createdAt().isBefore(filter.timeRange().start())) {
                stoppedEarly = true;
                break;
            }
            if (filter.matches(b)) {
                result.add(b);
                if (filter.limit() > 0 && result.size() >= filter.limit()) {
                    stoppedEarly = true;
                    break;
                }
            }
        }
        if (!stoppedEarly && floor > 0) {
            log.warn("Index scan stopped after {} batches (ledger.max-scan); {} older batches not searched",
                    maxScan, floor);
        }

        log.debug("Index query {} -> {} batches", filter, result.size());
        return result;
    }

    public Optional<BatchDescriptor> getBatchById(String batchId) {
        Function fn = new Function(
                "getBatchById",
                Collections.singletonList(new Utf8String(batchId)),
                BatchRecordDecoder.batchOutputs()
        );
        String resultHex = call(fn);
        return decode(fn.getName(), () -> BatchRecordDecoder.decodeBatch(resultHex));
    }

    private Optional<BatchDescriptor> getBatchAt(long index) {
        Function fn = new Function(
                "getBatchAt",
                Collections.singletonList(new Uint256(BigInteger.valueOf(index))),
                BatchRecordDecoder.batchOutputs()
        );
        String resultHex = call(fn);
        return decode(fn.getName(), () -> BatchRecordDecoder.decodeBatch(resultHex));
    }

    @Override
    public Optional<Hash32> getBatchRoot(String batchId) {
        Function fn = new Function(
                "getBatchRoot",
                Collections.singletonList(new Utf8String(batchId)),
                BatchRecordDecoder.rootOutputs()
        );
        String resultHex = call(fn);
        return decode(fn.getName(), () -> BatchRecordDecoder.decodeRoot(resultHex));
    }

    @Override
    public long countBatches() {
        Function fn = new Function(
                "getBatchCount",
                Collections.<Type>emptyList(),
                BatchRecordDecoder.countOutputs()
        );
        String resultHex = call(fn);
        return decode(fn.getName(), () -> BatchRecordDecoder.decodeCount(resultHex));
    }

    /**
     * Runs a constant call on the solidity node and returns the raw result hex.
     * Node and transport failures are transient; a rejected call is not.
     */
    private String call(Function fn) {
        if (contractAddress == null || contractAddress.isBlank()) {
            throw new CollaboratorException("ledger.contract-address is not configured");
        }
        String encodedHex = FunctionEncoder.encode(fn);

        Response.TransactionExtention txn;
        try {
            txn = wrapper.triggerConstantContract(
                    callerAddress,
                    contractAddress,
                    encodedHex,
                    NodeType.SOLIDITY_NODE
            );
        } catch (Exception e) {
            throw new TransientCollaboratorException(fn.getName() + " call failed: " + e.getMessage(), e);
        }

        if (!txn.getResult().getResult()) {
            throw new CollaboratorException(fn.getName() + " rejected: " + txn.getResult().getMessage().toStringUtf8());
        }
        if (txn.getConstantResultCount() == 0) {
            throw new CollaboratorException("No constantResult for " + fn.getName());
        }
        return Numeric.toHexString(txn.getConstantResult(0).toByteArray());
    }

    private static <T> T decode(String function, Supplier<T> decoder) {
        try {
            return decoder.get();
        } catch (RuntimeException e) {
            throw new CollaboratorException("Malformed " + function + " output: " + e.getMessage(), e);
        }
    }

    @jakarta.annotation.PreDestroy
    public void shutdown() {
        wrapper.close();
    }
}
