package com.flagship.coop_ledger.ledger;

import com.flagship.coop_ledger.common.error.CoopLedgerException;
import com.flagship.coop_ledger.common.error.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Chart-of-accounts registry.
 *
 * Plain JDBC like the posting engine, so both share the same view of the
 * {@code accounts} and {@code account_balances} tables inside one transaction.
 */
@Service
@Slf4j
public class AccountService {

    static final String DEFAULT_BRANCH = "00";
    static final String DEFAULT_SUB_TYPE = "01";

    private static final String SELECT_ACCOUNT =
        "SELECT id, tenant_id, code, name, account_type, is_group, is_active, bound_operator_id, created_at " +
        "FROM accounts ";

    private final JdbcTemplate jdbcTemplate;

    public AccountService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Creates an account with a zero balance.
     *
     * @param code explicit code, or null to take the next serial under the type's root GL head
     * @throws CoopLedgerException INVALID_ACCOUNT_CODE or DUPLICATE_ACCOUNT_CODE
     */
    @Transactional
    public Account createAccount(String tenantId, String code, String name, AccountType accountType,
                                 boolean group, String boundOperatorId) {
        AccountCode accountCode = code != null
            ? AccountCode.parse(code)
            : nextCode(tenantId, DEFAULT_BRANCH, accountType.defaultGlHead(), DEFAULT_SUB_TYPE);
        accountCode.requireType(accountType);

        if (findByCode(tenantId, accountCode.toString()).isPresent()) {
            throw duplicate(tenantId, accountCode);
        }

        UUID accountId = UUID.randomUUID();
        Instant createdAt = Instant.now();
        try {
            jdbcTemplate.update(
                "INSERT INTO accounts (id, tenant_id, code, name, account_type, is_group, is_active, " +
                "bound_operator_id, created_at) VALUES (?, ?, ?, ?, ?, ?, TRUE, ?, ?)",
                accountId,
                tenantId,
                accountCode.toString(),
                name,
                accountType.name(),
                group,
                boundOperatorId,
                Timestamp.from(createdAt)
            );
        } catch (DuplicateKeyException e) {
            throw duplicate(tenantId, accountCode);
        }
        jdbcTemplate.update(
            "INSERT INTO account_balances (account_id, tenant_id, balance) VALUES (?, ?, 0)",
            accountId,
            tenantId
        );

        log.info("Created account: code={}, type={}, group={}, boundOperator={}",
            accountCode, accountType, group, boundOperatorId);

        return new Account(accountId, tenantId, accountCode.toString(), name, accountType,
            group, true, boundOperatorId, createdAt);
    }

    /**
     * Next free code under {@code branch-glHead-subType}: highest existing serial plus one.
     */
    @Transactional(readOnly = true)
    public AccountCode nextCode(String tenantId, String branch, String glHead, String subType) {
        String prefix = AccountCode.of(branch, glHead, subType, 1).prefix();
        String maxCode = jdbcTemplate.queryForObject(
            "SELECT MAX(code) FROM accounts WHERE tenant_id = ? AND code LIKE ?",
            String.class,
            tenantId,
            prefix + "%"
        );
        return maxCode == null
            ? AccountCode.of(branch, glHead, subType, 1)
            : AccountCode.parse(maxCode).next();
    }

    public Optional<Account> findById(UUID accountId) {
        return jdbcTemplate.query(SELECT_ACCOUNT + "WHERE id = ?", accountRowMapper(), accountId)
            .stream()
            .findFirst();
    }

    /**
     * Loads an account owned by the tenant.
     *
     * @throws CoopLedgerException ACCOUNT_NOT_FOUND, also when the account belongs to another tenant
     */
    public Account getAccount(String tenantId, UUID accountId) {
        return findById(accountId)
            .filter(account -> account.getTenantId().equals(tenantId))
            .orElseThrow(() -> notFound(accountId));
    }

    public Optional<Account> findByCode(String tenantId, String code) {
        return jdbcTemplate.query(SELECT_ACCOUNT + "WHERE tenant_id = ? AND code = ?",
                accountRowMapper(), tenantId, code)
            .stream()
            .findFirst();
    }

    /**
     * All teller cash drawers of a tenant: active leaf asset accounts bound to an operator.
     */
    public List<Account> findTellerCashAccounts(String tenantId) {
        return jdbcTemplate.query(
            SELECT_ACCOUNT +
            "WHERE tenant_id = ? AND bound_operator_id IS NOT NULL AND is_group = FALSE " +
            "AND is_active = TRUE AND account_type = 'ASSET' ORDER BY code",
            accountRowMapper(),
            tenantId
        );
    }

    /**
     * The single cash drawer bound to a teller.
     *
     * @throws CoopLedgerException TELLER_ACCOUNT_NOT_MAPPED when no account or more than one matches
     */
    public Account findTellerCashAccount(String tenantId, String tellerId) {
        List<Account> matches = jdbcTemplate.query(
            SELECT_ACCOUNT +
            "WHERE tenant_id = ? AND bound_operator_id = ? AND is_group = FALSE " +
            "AND is_active = TRUE AND account_type = 'ASSET' ORDER BY code",
            accountRowMapper(),
            tenantId,
            tellerId
        );
        if (matches.size() != 1) {
            throw new CoopLedgerException(ErrorCode.TELLER_ACCOUNT_NOT_MAPPED,
                matches.isEmpty()
                    ? "No cash account is bound to teller " + tellerId
                    : String.format("Teller %s is bound to %d cash accounts; exactly one is required",
                        tellerId, matches.size()),
                Map.of("tellerId", tellerId,
                    "matchingAccounts", matches.stream().map(Account::getCode).toList()));
        }
        return matches.get(0);
    }

    private CoopLedgerException duplicate(String tenantId, AccountCode code) {
        return new CoopLedgerException(ErrorCode.DUPLICATE_ACCOUNT_CODE,
            "Account code already exists: " + code,
            Map.of("tenantId", tenantId, "code", code.toString()));
    }

    private CoopLedgerException notFound(UUID accountId) {
        return new CoopLedgerException(ErrorCode.ACCOUNT_NOT_FOUND,
            "Account not found: " + accountId, Map.of("accountId", accountId));
    }

    private RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> new Account(
            UUID.fromString(rs.getString("id")),
            rs.getString("tenant_id"),
            rs.getString("code"),
            rs.getString("name"),
            AccountType.valueOf(rs.getString("account_type")),
            rs.getBoolean("is_group"),
            rs.getBoolean("is_active"),
            rs.getString("bound_operator_id"),
            rs.getTimestamp("created_at").toInstant()
        );
    }
}
