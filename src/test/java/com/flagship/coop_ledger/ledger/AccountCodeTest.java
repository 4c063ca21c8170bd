package com.flagship.coop_ledger.ledger;

import com.flagship.coop_ledger.common.error.CoopLedgerException;
import com.flagship.coop_ledger.common.error.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AccountCodeTest {

    @Test
    @DisplayName("A well-formed code parses into its four segments")
    void parsesSegments() {
        AccountCode code = AccountCode.parse("01-10200-03-00042");

        assertEquals("01", code.getBranch());
        assertEquals("10200", code.getGlHead());
        assertEquals("03", code.getSubType());
        assertEquals(42, code.getSerial());
        assertEquals("01-10200-03-00042", code.toString());
        assertEquals("01-10200-03-", code.prefix());
    }

    @Test
    @DisplayName("Malformed codes are rejected with INVALID_ACCOUNT_CODE")
    void rejectsMalformedCodes() {
        for (String bad : new String[] {"10200", "1-10200-03-00042", "01-10200-03-0042", "01-1020A-03-00042", ""}) {
            CoopLedgerException e = assertThrows(CoopLedgerException.class, () -> AccountCode.parse(bad),
                "Should reject " + bad);
            assertEquals(ErrorCode.INVALID_ACCOUNT_CODE, e.getCode());
        }
        assertThrows(CoopLedgerException.class, () -> AccountCode.parse(null));
    }

    @Test
    @DisplayName("Serial numbers start at 00001")
    void rejectsZeroSerial() {
        CoopLedgerException e = assertThrows(CoopLedgerException.class,
            () -> AccountCode.parse("00-10100-01-00000"));
        assertEquals(ErrorCode.INVALID_ACCOUNT_CODE, e.getCode());
        assertThrows(CoopLedgerException.class, () -> AccountCode.of("00", "10100", "01", 100000));
    }

    @Test
    @DisplayName("next() increments the serial under the same prefix")
    void nextIncrementsSerial() {
        AccountCode next = AccountCode.parse("00-10100-01-00009").next();
        assertEquals("00-10100-01-00010", next.toString());
    }

    @Test
    @DisplayName("The leading GL head digit decides the account class")
    void glHeadDecidesAccountType() {
        AccountCode asset = AccountCode.parse("00-10100-01-00001");
        AccountCode income = AccountCode.parse("00-40900-01-00001");

        assertTrue(asset.belongsTo(AccountType.ASSET));
        assertFalse(asset.belongsTo(AccountType.LIABILITY));
        assertTrue(income.belongsTo(AccountType.REVENUE));

        CoopLedgerException e = assertThrows(CoopLedgerException.class,
            () -> income.requireType(AccountType.EXPENSE));
        assertEquals(ErrorCode.INVALID_ACCOUNT_CODE, e.getCode());
    }
}
