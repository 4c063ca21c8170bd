package com.flagship.coop_ledger.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An entry in a tenant's chart of accounts.
 *
 * Group accounts only aggregate their children and never receive postings.
 * An account with a {@code boundOperatorId} is that operator's cash drawer.
 */
@Value
public class Account {
    UUID id;
    String tenantId;
    String code;
    String name;
    AccountType accountType;
    boolean group;
    boolean active;
    String boundOperatorId;
    Instant createdAt;

    public boolean isPostable() {
        return !group;
    }
}
