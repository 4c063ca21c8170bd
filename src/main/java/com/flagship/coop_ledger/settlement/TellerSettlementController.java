package com.flagship.coop_ledger.settlement;

import com.flagship.coop_ledger.common.web.ApiHeaders;
import com.flagship.coop_ledger.daybook.DayBook;
import com.flagship.coop_ledger.daybook.DayBookService;
import com.flagship.coop_ledger.settlement.dto.SettleRequest;
import com.flagship.coop_ledger.settlement.dto.SettlementPreviewResponse;
import com.flagship.coop_ledger.settlement.dto.SettlementResponse;
import com.flagship.coop_ledger.settlement.dto.UnsettleRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Teller settlement endpoints.
 *
 * Settle is idempotent: the same Idempotency-Key (header, or {@code idempotency_key}
 * in the body) returns the original settlement with 200 instead of 201.
 */
@RestController
@RequestMapping("/api/day-book")
@RequiredArgsConstructor
@Slf4j
public class TellerSettlementController {

    private final TellerSettlementService settlementService;
    private final DayBookService dayBookService;

    @PostMapping("/settle/preview")
    public ResponseEntity<SettlementPreviewResponse> preview(
            @Valid @RequestBody SettleRequest request,
            @RequestHeader(ApiHeaders.TENANT_ID) String tenantId,
            @RequestHeader(ApiHeaders.USER_ID) String userId) {
        SettlementPlan plan = settlementService.preview(toCommand(request, tenantId, userId, null));
        return ResponseEntity.ok(SettlementPreviewResponse.from(plan));
    }

    @PostMapping("/settle")
    public ResponseEntity<SettlementResponse> settle(
            @Valid @RequestBody SettleRequest request,
            @RequestHeader(ApiHeaders.TENANT_ID) String tenantId,
            @RequestHeader(ApiHeaders.USER_ID) String userId,
            @RequestHeader(value = ApiHeaders.IDEMPOTENCY_KEY, required = false) String idempotencyKeyHeader) {

        String idempotencyKey = idempotencyKeyHeader != null && !idempotencyKeyHeader.isBlank()
            ? idempotencyKeyHeader
            : request.getIdempotencyKey();
        log.info("Received settlement request: teller={}, physicalCash={}, idempotencyKey={}",
            request.getTellerId(), request.getPhysicalCash(), idempotencyKey);

        SettlementOutcome outcome;
        try {
            outcome = settlementService.settle(toCommand(request, tenantId, userId, idempotencyKey));
        } catch (DataIntegrityViolationException e) {
            if (idempotencyKey == null || idempotencyKey.isBlank()) {
                throw e;
            }
            // Lost the race to a concurrent call with the same key
            TellerSettlement winner = settlementService.findByReference(tenantId, idempotencyKey)
                .orElseThrow(() -> e);
            log.info("Concurrent settlement with the same key won, returning it: settlementId={}", winner.getId());
            outcome = SettlementOutcome.replayed(winner);
        }

        SettlementResponse body = SettlementResponse.from(outcome.getSettlement());
        return outcome.isReplayed()
            ? ResponseEntity.ok(body)
            : ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @PostMapping("/unsettle")
    public ResponseEntity<SettlementResponse> unsettle(
            @Valid @RequestBody UnsettleRequest request,
            @RequestHeader(ApiHeaders.TENANT_ID) String tenantId,
            @RequestHeader(ApiHeaders.USER_ID) String userId) {
        TellerSettlement settlement =
            settlementService.unsettle(tenantId, request.getSettlementId(), userId, request.getReason());
        return ResponseEntity.ok(SettlementResponse.from(settlement));
    }

    @PostMapping("/settlements/{id}/approve")
    public ResponseEntity<SettlementResponse> approve(
            @PathVariable("id") UUID id,
            @RequestHeader(ApiHeaders.TENANT_ID) String tenantId,
            @RequestHeader(ApiHeaders.USER_ID) String userId) {
        return ResponseEntity.ok(SettlementResponse.from(settlementService.approve(tenantId, id, userId)));
    }

    @GetMapping("/settlements/{id}")
    public ResponseEntity<SettlementResponse> getSettlement(
            @PathVariable("id") UUID id,
            @RequestHeader(ApiHeaders.TENANT_ID) String tenantId) {
        return ResponseEntity.ok(SettlementResponse.from(settlementService.getSettlement(tenantId, id)));
    }

    /**
     * An unknown {@code day} yields an empty page rather than every settlement.
     */
    @GetMapping("/settlements")
    public ResponseEntity<Page<SettlementResponse>> list(
            @RequestHeader(ApiHeaders.TENANT_ID) String tenantId,
            @RequestParam(value = "day", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate day,
            @RequestParam(value = "tellerId", required = false) String tellerId,
            @RequestParam(value = "status", required = false) SettlementStatus status,
            @RequestParam(value = "page", defaultValue = "0") int page,
            @RequestParam(value = "size", defaultValue = "50") int size) {

        PageRequest pageable = PageRequest.of(page, Math.min(Math.max(size, 1), 200),
            Sort.by(Sort.Direction.DESC, "executedAt"));
        UUID dayBookId = null;
        if (day != null) {
            dayBookId = dayBookService.findByDate(tenantId, day).map(DayBook::getId).orElse(null);
            if (dayBookId == null) {
                return ResponseEntity.ok(Page.empty(pageable));
            }
        }
        return ResponseEntity.ok(settlementService.list(tenantId, dayBookId, tellerId, status, pageable)
            .map(SettlementResponse::from));
    }

    private static SettleCommand toCommand(SettleRequest request, String tenantId, String userId,
                                           String idempotencyKey) {
        return SettleCommand.builder()
            .tenantId(tenantId)
            .tellerId(request.getTellerId())
            .physicalCash(request.getPhysicalCash())
            .actorId(userId)
            .denominations(request.getDenominations())
            .attachmentRef(request.getAttachmentRef())
            .idempotencyKey(idempotencyKey)
            .build();
    }
}
