package dao.tron.txverify.scheduler;

import dao.tron.txverify.service.BatchMetadataCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class CacheSweepScheduler {

    private final BatchMetadataCache cache;

    public CacheSweepScheduler(BatchMetadataCache cache) {
        this.cache = cache;
    }

    @Scheduled(fixedDelayString = "${verifier.cache.sweep-interval-ms:60000}")
    public void sweepExpiredBatches() {
        int removed = cache.sweep();
        if (removed == 0) {
            log.trace("Cache sweep: nothing expired ({} entries)", cache.size());
        }
    }
}
