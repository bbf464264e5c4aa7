package dao.tron.txverify.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "ledger")
@Data
public class LedgerProperties {

    /**
     * tron: read the audit contract through a TRON node.
     * in-memory: empty local index, for development and tests.
     */
    private String mode = "tron";

    /**
     * nile, shasta, mainnet or custom (uses nodeEndpoint / solidityEndpoint).
     * Default: nile
     */
    private String network = "nile";

    /**
     * gRPC endpoint of a full node, used when network=custom
     * Example: grpc.nile.trongrid.io:50051
     */
    private String nodeEndpoint;

    /**
     * gRPC endpoint of a solidity node, used when network=custom
     * Example: grpc.nile.trongrid.io:50061
     */
    private String solidityEndpoint;

    /**
     * Audit ledger contract address (base58 format)
     * Example: TAhZaywaWM1zAQPADJA39FyoQk8cokRLCd
     */
    private String contractAddress;

    /**
     * Optional private key (hex). Calls are read-only; without a key a throwaway key pair is generated
     * to sign nothing and serve as the caller address.
     */
    private String privateKey;

    /**
     * TronGrid API key, required by mainnet.
     */
    private String apiKey;

    /**
     * Upper bound on batches walked by one index query when the filter cannot stop the scan early.
     * Default: 5000
     */
    private int maxScan = 5000;
}
