package dao.tron.txverify.config;

import dao.tron.txverify.client.LedgerClient;
import dao.tron.txverify.model.BatchIndexFilter;
import dao.tron.txverify.service.BatchMetadataCache;
import dao.tron.txverify.service.HashAlgorithm;
import dao.tron.txverify.service.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Slf4j
@Configuration
public class VerifierConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public HashAlgorithm hashAlgorithm(VerifierProperties props) {
        log.info("Record and node digests use {}", props.getHashAlgorithm());
        return props.getHashAlgorithm();
    }

    @Bean
    public RetryPolicy retryPolicy(VerifierProperties props) {
        VerifierProperties.RetryConfig retry = props.getRetry();
        return new RetryPolicy(retry.getMaxAttempts(), retry.getBaseDelayMs(), retry.getMaxDelayMs(), retry.getJitterMs());
    }

    @Bean
    public BatchMetadataCache batchMetadataCache(LedgerClient ledger,
                                                 RetryPolicy retryPolicy,
                                                 VerifierProperties props,
                                                 Clock clock) {
        VerifierProperties.CacheConfig cache = props.getCache();
        return new BatchMetadataCache(
                batchId -> retryPolicy.call("getBatch " + batchId,
                        () -> ledger.queryBatchIndex(BatchIndexFilter.forBatchId(batchId)).stream().findFirst()),
                Duration.ofSeconds(cache.getTtlSeconds()),
                cache.getMaxEntries(),
                clock
        );
    }
}
