package com.flagship.coop_ledger.ledger;

import com.flagship.coop_ledger.common.web.ApiHeaders;
import com.flagship.coop_ledger.ledger.dto.JournalEntryResponse;
import com.flagship.coop_ledger.ledger.dto.PostJournalRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/journal-entries")
@RequiredArgsConstructor
public class JournalController {

    private final ManualJournalService manualJournalService;
    private final LedgerService ledgerService;

    @PostMapping
    public ResponseEntity<JournalEntryResponse> post(
            @Valid @RequestBody PostJournalRequest request,
            @RequestHeader(ApiHeaders.TENANT_ID) String tenantId,
            @RequestHeader(ApiHeaders.USER_ID) String userId) {
        List<JournalLine> lines = request.getLines().stream()
            .map(line -> JournalLine.of(line.getAccountId(), orZero(line.getDebit()), orZero(line.getCredit())))
            .toList();
        PostingResult result = manualJournalService.post(tenantId, request.getDescription(), lines, userId);
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(JournalEntryResponse.from(result.getJournalEntry(), result.getLedgerLines()));
    }

    @GetMapping("/{id}/lines")
    public ResponseEntity<JournalEntryResponse> getLines(
            @PathVariable("id") UUID id,
            @RequestHeader(ApiHeaders.TENANT_ID) String tenantId) {
        JournalEntry entry = ledgerService.getJournalEntry(tenantId, id);
        return ResponseEntity.ok(JournalEntryResponse.from(entry, ledgerService.getLedgerLines(id)));
    }

    private static BigDecimal orZero(BigDecimal amount) {
        return amount != null ? amount : BigDecimal.ZERO;
    }
}
