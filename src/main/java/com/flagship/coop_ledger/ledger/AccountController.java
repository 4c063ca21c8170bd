package com.flagship.coop_ledger.ledger;

import com.flagship.coop_ledger.audit.AuditAction;
import com.flagship.coop_ledger.audit.AuditLogService;
import com.flagship.coop_ledger.common.web.ApiHeaders;
import com.flagship.coop_ledger.ledger.dto.AccountResponse;
import com.flagship.coop_ledger.ledger.dto.AssignRoleRequest;
import com.flagship.coop_ledger.ledger.dto.CreateAccountRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
public class AccountController {

    private final AccountService accountService;
    private final AccountRoleRegistry roleRegistry;
    private final LedgerService ledgerService;
    private final AuditLogService auditLogService;

    @PostMapping
    public ResponseEntity<AccountResponse> createAccount(
            @Valid @RequestBody CreateAccountRequest request,
            @RequestHeader(ApiHeaders.TENANT_ID) String tenantId,
            @RequestHeader(ApiHeaders.USER_ID) String userId) {
        Account account = accountService.createAccount(tenantId, request.getCode(), request.getName(),
            request.getAccountType(), request.isGroup(), request.getBoundOperatorId());
        auditLogService.record(tenantId, userId, AuditAction.ACCOUNT_CREATED, "Account", account.getId(),
            Map.of("code", account.getCode(), "type", account.getAccountType()));
        return ResponseEntity.status(HttpStatus.CREATED).body(AccountResponse.from(account, BigDecimal.ZERO));
    }

    @GetMapping("/{id}/balance")
    public ResponseEntity<AccountResponse> getBalance(
            @PathVariable("id") UUID id,
            @RequestHeader(ApiHeaders.TENANT_ID) String tenantId) {
        Account account = accountService.getAccount(tenantId, id);
        return ResponseEntity.ok(AccountResponse.from(account, ledgerService.getAccountBalance(id)));
    }

    @PutMapping("/roles/{role}")
    public ResponseEntity<AccountResponse> assignRole(
            @PathVariable("role") AccountRole role,
            @Valid @RequestBody AssignRoleRequest request,
            @RequestHeader(ApiHeaders.TENANT_ID) String tenantId,
            @RequestHeader(ApiHeaders.USER_ID) String userId) {
        Account account = roleRegistry.assign(tenantId, role, request.getAccountId());
        auditLogService.record(tenantId, userId, AuditAction.ACCOUNT_ROLE_ASSIGNED, "Account", account.getId(),
            Map.of("role", role));
        return ResponseEntity.ok(AccountResponse.from(account, ledgerService.getAccountBalance(account.getId())));
    }
}
