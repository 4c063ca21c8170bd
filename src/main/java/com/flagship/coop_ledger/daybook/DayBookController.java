package com.flagship.coop_ledger.daybook;

import com.flagship.coop_ledger.common.web.ApiHeaders;
import com.flagship.coop_ledger.daybook.dto.DayBookResponse;
import com.flagship.coop_ledger.daybook.dto.DayControlRequest;
import com.flagship.coop_ledger.daybook.dto.DayStatusResponse;
import com.flagship.coop_ledger.daybook.dto.EodSummaryResponse;
import com.flagship.coop_ledger.daybook.dto.StartDayRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

/**
 * Business day control: begin, close, force close, reopen and the end-of-day summary.
 * Settlement routes under the same prefix live in the settlement controller.
 */
@RestController
@RequestMapping("/api/day-book")
@RequiredArgsConstructor
@Slf4j
public class DayBookController {

    private final DayBookService dayBookService;
    private final DayCloseService dayCloseService;
    private final EodSummaryService eodSummaryService;
    private final BusinessCalendar calendar;

    @GetMapping("/status")
    public ResponseEntity<DayStatusResponse> getStatus(@RequestHeader(ApiHeaders.TENANT_ID) String tenantId) {
        LocalDate today = calendar.today();
        return ResponseEntity.ok(dayBookService.getStatus(tenantId)
            .map(day -> DayStatusResponse.of(day, today))
            .orElseGet(() -> DayStatusResponse.noDay(today)));
    }

    @PostMapping("/start")
    public ResponseEntity<DayBookResponse> startDay(
            @RequestBody(required = false) StartDayRequest request,
            @RequestHeader(ApiHeaders.TENANT_ID) String tenantId,
            @RequestHeader(ApiHeaders.USER_ID) String userId) {
        LocalDate date = request != null && request.getDate() != null ? request.getDate() : calendar.today();
        DayBook day = dayBookService.startDay(tenantId, date, userId);
        return ResponseEntity.status(HttpStatus.CREATED).body(DayBookResponse.from(day));
    }

    @PostMapping("/close")
    public ResponseEntity<DayBookResponse> closeDay(
            @RequestHeader(ApiHeaders.TENANT_ID) String tenantId,
            @RequestHeader(ApiHeaders.USER_ID) String userId) {
        return ResponseEntity.ok(DayBookResponse.from(dayCloseService.closeDay(tenantId, userId)));
    }

    @PostMapping("/close/force")
    public ResponseEntity<DayBookResponse> forceCloseDay(
            @Valid @RequestBody DayControlRequest request,
            @RequestHeader(ApiHeaders.TENANT_ID) String tenantId,
            @RequestHeader(ApiHeaders.USER_ID) String userId) {
        DayBook day = dayCloseService.forceCloseDay(tenantId, userId, request.getReason(), request.getApproverId());
        return ResponseEntity.ok(DayBookResponse.from(day));
    }

    @PostMapping("/reopen")
    public ResponseEntity<DayBookResponse> reopenDay(
            @Valid @RequestBody DayControlRequest request,
            @RequestHeader(ApiHeaders.TENANT_ID) String tenantId,
            @RequestHeader(ApiHeaders.USER_ID) String userId) {
        DayBook day = request.getDate() == null
            ? dayCloseService.reopenDay(tenantId, userId, request.getReason(), request.getApproverId())
            : dayCloseService.reopenDay(tenantId, request.getDate(), userId, request.getReason(),
                request.getApproverId());
        return ResponseEntity.ok(DayBookResponse.from(day));
    }

    @GetMapping("/reports/eod")
    public ResponseEntity<EodSummaryResponse> getEodSummary(
            @RequestHeader(ApiHeaders.TENANT_ID) String tenantId,
            @RequestParam(value = "day", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate day) {
        return ResponseEntity.ok(EodSummaryResponse.from(eodSummaryService.summarize(tenantId, day)));
    }
}
