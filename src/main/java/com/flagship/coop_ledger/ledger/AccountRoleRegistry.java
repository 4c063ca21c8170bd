package com.flagship.coop_ledger.ledger;

import com.flagship.coop_ledger.common.error.CoopLedgerException;
import com.flagship.coop_ledger.common.error.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Per-tenant mapping from {@link AccountRole} to a single account id.
 *
 * There is no fallback to code-prefix matching: an unmapped role is a
 * configuration error the caller has to see.
 */
@Service
@Slf4j
public class AccountRoleRegistry {

    static final String SUSPENSE_CODE = "00-10300-01-00001";
    static final String SUSPENSE_NAME = "Suspense Account (Manager Liability)";

    private final JdbcTemplate jdbcTemplate;
    private final AccountService accountService;

    public AccountRoleRegistry(JdbcTemplate jdbcTemplate, AccountService accountService) {
        this.jdbcTemplate = jdbcTemplate;
        this.accountService = accountService;
    }

    /**
     * Points a role at an account, replacing any previous mapping.
     */
    @Transactional
    public Account assign(String tenantId, AccountRole role, UUID accountId) {
        Account account = accountService.getAccount(tenantId, accountId);
        if (!account.isPostable()) {
            throw new CoopLedgerException(ErrorCode.ACCOUNT_NOT_POSTABLE,
                String.format("Group account %s cannot serve as %s", account.getCode(), role),
                Map.of("accountId", accountId, "role", role.name()));
        }
        jdbcTemplate.update(
            "INSERT INTO account_role_mappings (tenant_id, role, account_id) VALUES (?, ?, ?) " +
            "ON CONFLICT (tenant_id, role) DO UPDATE SET account_id = EXCLUDED.account_id, " +
            "updated_at = CURRENT_TIMESTAMP",
            tenantId,
            role.name(),
            accountId
        );
        log.info("Assigned account role: role={}, account={}", role, account.getCode());
        return account;
    }

    public Optional<Account> find(String tenantId, AccountRole role) {
        return jdbcTemplate.queryForList(
                "SELECT account_id FROM account_role_mappings WHERE tenant_id = ? AND role = ?",
                UUID.class, tenantId, role.name())
            .stream()
            .findFirst()
            .flatMap(accountService::findById);
    }

    /**
     * @throws CoopLedgerException ACCOUNT_ROLE_NOT_CONFIGURED when the tenant has not mapped the role
     */
    public Account resolve(String tenantId, AccountRole role) {
        return find(tenantId, role)
            .orElseThrow(() -> new CoopLedgerException(ErrorCode.ACCOUNT_ROLE_NOT_CONFIGURED,
                "No account is configured for role " + role,
                Map.of("tenantId", tenantId, "role", role.name())));
    }

    /**
     * Suspense account for force closes, created and mapped on first use.
     */
    @Transactional
    public Account resolveOrCreateSuspense(String tenantId) {
        Optional<Account> mapped = find(tenantId, AccountRole.SUSPENSE);
        if (mapped.isPresent()) {
            return mapped.get();
        }
        Account suspense = accountService.findByCode(tenantId, SUSPENSE_CODE)
            .orElseGet(() -> accountService.createAccount(
                tenantId, SUSPENSE_CODE, SUSPENSE_NAME, AccountType.ASSET, false, null));
        log.info("Suspense account mapped on first use: code={}", suspense.getCode());
        return assign(tenantId, AccountRole.SUSPENSE, suspense.getId());
    }
}
