package dao.tron.txverify.controller;

import dao.tron.txverify.model.BatchVerificationReport;
import dao.tron.txverify.model.VerificationHint;
import dao.tron.txverify.model.VerificationItem;
import dao.tron.txverify.model.VerificationVerdict;
import dao.tron.txverify.model.VerifyBatchItemRequest;
import dao.tron.txverify.model.VerifyBatchRequest;
import dao.tron.txverify.model.VerifyTransactionRequest;
import dao.tron.txverify.service.VerificationService;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/verify")
public class VerificationController {

    private final VerificationService verificationService;

    public VerificationController(VerificationService verificationService) {
        this.verificationService = verificationService;
    }

    /**
     * POST /api/verify/transaction
     * Verdict for one record. 400 when the hint or the record shape is invalid.
     */
    @PostMapping("/transaction")
    public ResponseEntity<VerificationVerdict> verifyTransaction(@Valid @RequestBody VerifyTransactionRequest request) {
        VerificationHint hint = request.getHint() != null ? request.getHint() : VerificationHint.empty();
        VerificationVerdict verdict = verificationService.verifyTransaction(
                request.getRecord().toRecord(hint),
                hint,
                seconds(request.getTimeoutSeconds()));
        return ResponseEntity.ok(verdict);
    }

    /**
     * POST /api/verify/batch
     * Verdicts in request order plus totals. A top-level hint applies to items without their own;
     * bad item hints come back as that item's ERROR verdict.
     */
    @PostMapping("/batch")
    public ResponseEntity<BatchVerificationReport> verifyBatch(@Valid @RequestBody VerifyBatchRequest request) {
        VerificationHint shared = request.getHint();
        List<VerificationItem> items = new ArrayList<>(request.getItems().size());
        for (VerifyBatchItemRequest item : request.getItems()) {
            VerificationHint hint = item.getHint() != null ? item.getHint() : shared;
            items.add(new VerificationItem(item.getRecord().toRecord(hint), hint));
        }
        log.debug("verify_batch request: {} items, failFast={}, parallel={}",
                items.size(), request.isFailFast(), request.isParallel());
        return ResponseEntity.ok(verificationService.verifyBatch(
                items, seconds(request.getTimeoutSeconds()), request.isFailFast(), request.isParallel()));
    }

    private static Duration seconds(Long value) {
        return value == null ? null : Duration.ofSeconds(value);
    }
}
