package com.flagship.coop_ledger.ledger;

import com.flagship.coop_ledger.common.error.CoopLedgerException;
import com.flagship.coop_ledger.common.error.ErrorCode;
import lombok.Value;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Hierarchical account code {@code BB-GGGGG-SS-SSSSS}: branch, GL head, sub-type, serial.
 *
 * The code identifies an account to people. Nothing resolves an account's
 * purpose from its code; see {@link AccountRoleRegistry} for that.
 */
@Value
public class AccountCode {

    private static final Pattern FORMAT = Pattern.compile("^(\\d{2})-(\\d{5})-(\\d{2})-(\\d{5})$");
    private static final int MAX_SERIAL = 99999;

    String branch;
    String glHead;
    String subType;
    int serial;

    public static AccountCode of(String branch, String glHead, String subType, int serial) {
        if (serial < 1 || serial > MAX_SERIAL) {
            throw invalid(branch + "-" + glHead + "-" + subType + "-" + serial, "serial out of range");
        }
        return parse(String.format("%s-%s-%s-%05d", branch, glHead, subType, serial));
    }

    public static AccountCode parse(String code) {
        if (code == null) {
            throw invalid(null, "code is required");
        }
        Matcher matcher = FORMAT.matcher(code.trim());
        if (!matcher.matches()) {
            throw invalid(code, "expected format BB-GGGGG-SS-SSSSS");
        }
        int serial = Integer.parseInt(matcher.group(4));
        if (serial == 0) {
            throw invalid(code, "serial must start at 00001");
        }
        return new AccountCode(matcher.group(1), matcher.group(2), matcher.group(3), serial);
    }

    /**
     * Code shared by every sibling under the same branch, GL head and sub-type.
     */
    public String prefix() {
        return branch + "-" + glHead + "-" + subType + "-";
    }

    public AccountCode next() {
        return of(branch, glHead, subType, serial + 1);
    }

    public boolean belongsTo(AccountType type) {
        return glHead.charAt(0) - '0' == type.glHeadDigit();
    }

    public void requireType(AccountType type) {
        if (!belongsTo(type)) {
            throw new CoopLedgerException(ErrorCode.INVALID_ACCOUNT_CODE,
                String.format("Account code %s does not belong to %s (GL head must start with %d)",
                    this, type, type.glHeadDigit()),
                Map.of("code", toString(), "accountType", type.name()));
        }
    }

    @Override
    public String toString() {
        return String.format("%s%05d", prefix(), serial);
    }

    private static CoopLedgerException invalid(String code, String reason) {
        return new CoopLedgerException(ErrorCode.INVALID_ACCOUNT_CODE,
            "Invalid account code '" + code + "': " + reason,
            code == null ? Map.of() : Map.of("code", code));
    }
}
