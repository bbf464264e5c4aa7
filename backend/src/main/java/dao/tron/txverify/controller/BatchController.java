package dao.tron.txverify.controller;

import dao.tron.txverify.model.BatchDescriptor;
import dao.tron.txverify.model.BatchIndexFilter;
import dao.tron.txverify.model.BatchListQuery;
import dao.tron.txverify.model.BatchOrder;
import dao.tron.txverify.model.BatchPage;
import dao.tron.txverify.model.BatchSearchCriteria;
import dao.tron.txverify.model.LedgerInfo;
import dao.tron.txverify.model.SearchResults;
import dao.tron.txverify.model.TimeRange;
import dao.tron.txverify.service.HintResolver;
import dao.tron.txverify.service.VerificationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Batch browsing plus service metadata.
 */
@RestController
public class BatchController {

    private final VerificationService verificationService;
    private final HintResolver hintResolver;

    public BatchController(VerificationService verificationService, HintResolver hintResolver) {
        this.verificationService = verificationService;
        this.hintResolver = hintResolver;
    }

    /**
     * GET /api/batches/{batchId}
     */
    @GetMapping("/api/batches/{batchId}")
    public ResponseEntity<Object> getBatch(@PathVariable String batchId) {
        Optional<BatchDescriptor> batch = verificationService.getBatch(batchId);
        if (batch.isEmpty()) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("error", "Batch not found: " + batchId);
            return ResponseEntity.status(404).body(body);
        }
        return ResponseEntity.ok(batch.get());
    }

    /**
     * GET /api/batches
     * Filtered, ordered page of batches. Time bounds may be one-sided.
     */
    @GetMapping("/api/batches")
    public ResponseEntity<BatchPage> listBatches(
            @RequestParam(name = "database_name", required = false) String databaseName,
            @RequestParam(name = "table_name", required = false) String tableName,
            @RequestParam(name = "time_start", required = false) String timeStart,
            @RequestParam(name = "time_end", required = false) String timeEnd,
            @RequestParam(name = "min_tx_count", required = false) Integer minTxCount,
            @RequestParam(name = "max_tx_count", required = false) Integer maxTxCount,
            @RequestParam(name = "limit", defaultValue = "100") int limit,
            @RequestParam(name = "offset", defaultValue = "0") int offset,
            @RequestParam(name = "order_by", required = false) String orderBy) {

        Instant start = hintResolver.parseBound("time_start", timeStart);
        Instant end = hintResolver.parseBound("time_end", timeEnd);
        TimeRange range = start == null && end == null ? null : new TimeRange(start, end);

        BatchIndexFilter filter = new BatchIndexFilter(null, blankToNull(databaseName), blankToNull(tableName),
                range, minTxCount, maxTxCount, 0);
        BatchListQuery query = new BatchListQuery(filter, limit, offset, BatchOrder.fromParam(orderBy));
        return ResponseEntity.ok(verificationService.listBatches(query));
    }

    /**
     * POST /api/batches/search
     */
    @PostMapping("/api/batches/search")
    public ResponseEntity<SearchResults> searchBatches(@RequestBody BatchSearchCriteria criteria) {
        return ResponseEntity.ok(verificationService.searchBatches(criteria));
    }

    /**
     * GET /api/ledger
     */
    @GetMapping("/api/ledger")
    public ResponseEntity<LedgerInfo> ledgerInfo() {
        return ResponseEntity.ok(verificationService.ledgerInfo());
    }

    /**
     * GET /api/config
     */
    @GetMapping("/api/config")
    public ResponseEntity<Map<String, Object>> config() {
        return ResponseEntity.ok(verificationService.configView());
    }

    @GetMapping("/healthz")
    public ResponseEntity<String> healthz() {
        return ResponseEntity.ok("ok");
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
