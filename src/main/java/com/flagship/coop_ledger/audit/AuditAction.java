package com.flagship.coop_ledger.audit;

public enum AuditAction {
    ACCOUNT_CREATED,
    ACCOUNT_ROLE_ASSIGNED,
    JOURNAL_POSTED,
    DAY_STARTED,
    DAY_CLOSED,
    DAY_FORCE_CLOSED,
    DAY_REOPENED,
    TELLER_SETTLED,
    TELLER_UNSETTLED,
    SETTLEMENT_APPROVED
}
