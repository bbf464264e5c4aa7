package dao.tron.txverify.config;

import dao.tron.txverify.service.HashAlgorithm;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "verifier")
public class VerifierProperties {

    /**
     * Digest used for record hashes and Merkle nodes. Must match the recording pipeline.
     * Default: SHA256
     */
    private HashAlgorithm hashAlgorithm = HashAlgorithm.SHA256;

    private CacheConfig cache = new CacheConfig();
    private SearchConfig search = new SearchConfig();
    private OrchestratorConfig orchestrator = new OrchestratorConfig();
    private RetryConfig retry = new RetryConfig();

    @Data
    public static class CacheConfig {
        /**
         * How long a batch descriptor is served without asking the ledger again.
         * Default: 300 seconds
         */
        private long ttlSeconds = 300;

        /**
         * Capacity bound; expired entries go first, then those closest to expiry.
         * Default: 10000
         */
        private int maxEntries = 10_000;

        /**
         * Periodic sweep of expired entries (in milliseconds).
         * Default: 60000ms
         */
        private long sweepIntervalMs = 60_000;
    }

    @Data
    public static class SearchConfig {
        /**
         * Most-recent matching batches ranked per search; more sets "possibly incomplete".
         * Default: 50
         */
        private int maxCandidates = 50;

        /**
         * Candidates whose stored contents are opened per verification.
         * Default: 20
         */
        private int maxInspected = 20;

        /**
         * Score distance under which two containing batches count as tied (AMBIGUOUS).
         * Default: 0 (exact tie only)
         */
        private int tieMargin = 0;
    }

    @Data
    public static class OrchestratorConfig {
        /**
         * Verification worker threads.
         * Default: 4
         */
        private int workers = 4;

        /**
         * Deadline for a whole verify_batch call.
         * Default: 60 seconds
         */
        private long batchTimeoutSeconds = 60;

        /**
         * Deadline for a single verify_transaction call.
         * Default: 30 seconds
         */
        private long transactionTimeoutSeconds = 30;
    }

    @Data
    public static class RetryConfig {
        /**
         * Attempts per collaborator call, first one included.
         * Default: 3
         */
        private int maxAttempts = 3;

        /**
         * First backoff delay; doubles per attempt.
         * Default: 200ms
         */
        private long baseDelayMs = 200;

        /**
         * Backoff cap.
         * Default: 2000ms
         */
        private long maxDelayMs = 2000;

        /**
         * Random extra delay added per attempt, 0..jitterMs.
         * Default: 150ms
         */
        private long jitterMs = 150;
    }
}
