package com.txprocessor.model;

import com.txprocessor.common.TxEnums.ApplyError;
import com.txprocessor.common.TxEnums.DisputeStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class AccountTest {

    private Account account;

    @BeforeEach
    void setUp() {
        account = new Account(1);
    }

    private static BigDecimal amt(String value) {
        return new BigDecimal(value);
    }

    private void assertBalances(String available, String held, String total) {
        assertEquals(0, amt(available).compareTo(account.getAvailable()), "available");
        assertEquals(0, amt(held).compareTo(account.getHeld()), "held");
        assertEquals(0, amt(total).compareTo(account.getTotal()), "total");
        assertEquals(0, account.getTotal().compareTo(account.getAvailable().add(account.getHeld())));
        assertTrue(account.getAvailable().signum() >= 0);
        assertTrue(account.getHeld().signum() >= 0);
    }

    private void applied(Transaction tx) {
        assertEquals(Optional.empty(), account.apply(tx), "expected " + tx + " to be applied");
    }

    private void rejected(Transaction tx, ApplyError reason) {
        assertEquals(Optional.of(reason), account.apply(tx));
    }

    @Test
    @DisplayName("Two deposits accumulate in available")
    void depositsAccumulate() {
        applied(Transaction.deposit(1, 1, amt("10")));
        applied(Transaction.deposit(1, 2, amt("5")));

        assertBalances("15", "0", "15");
        assertFalse(account.isLocked());
    }

    @Test
    @DisplayName("Withdrawal above available is rejected without mutation")
    void withdrawalInsufficientFunds() {
        applied(Transaction.deposit(1, 1, amt("10")));
        applied(Transaction.deposit(1, 2, amt("5")));

        rejected(Transaction.withdrawal(1, 3, amt("20")), ApplyError.INSUFFICIENT_FUNDS);

        assertBalances("15", "0", "15");
        assertTrue(account.findEntry(3).isEmpty());
    }

    @Test
    void withdrawalOfExactBalance() {
        applied(Transaction.deposit(1, 1, amt("2.5")));
        applied(Transaction.withdrawal(1, 2, amt("2.5")));

        assertBalances("0", "0", "0");
    }

    @Test
    @DisplayName("Dispute holds funds, resolve releases them")
    void disputeThenResolve() {
        applied(Transaction.deposit(1, 1, amt("10")));

        applied(Transaction.dispute(1, 1));
        assertBalances("0", "10", "10");
        assertEquals(DisputeStatus.DISPUTED, account.findEntry(1).orElseThrow().getStatus());

        applied(Transaction.resolve(1, 1));
        assertBalances("10", "0", "10");
        assertEquals(DisputeStatus.RESOLVED, account.findEntry(1).orElseThrow().getStatus());
    }

    @Test
    @DisplayName("Chargeback removes held funds and locks the account for good")
    void chargebackLocks() {
        applied(Transaction.deposit(1, 1, amt("10")));
        applied(Transaction.dispute(1, 1));
        applied(Transaction.chargeback(1, 1));

        assertBalances("0", "0", "0");
        assertTrue(account.isLocked());
        assertEquals(DisputeStatus.CHARGED_BACK, account.findEntry(1).orElseThrow().getStatus());

        rejected(Transaction.deposit(1, 2, amt("100")), ApplyError.ACCOUNT_LOCKED);
        rejected(Transaction.withdrawal(1, 3, amt("1")), ApplyError.ACCOUNT_LOCKED);
        rejected(Transaction.dispute(1, 1), ApplyError.ACCOUNT_LOCKED);
        rejected(Transaction.resolve(1, 1), ApplyError.ACCOUNT_LOCKED);
        rejected(Transaction.chargeback(1, 1), ApplyError.ACCOUNT_LOCKED);

        assertBalances("0", "0", "0");
        assertTrue(account.isLocked());
        assertTrue(account.findEntry(2).isEmpty());
    }

    @Test
    void lockedAccountKeepsOtherFunds() {
        applied(Transaction.deposit(1, 1, amt("10")));
        applied(Transaction.deposit(1, 2, amt("7.25")));
        applied(Transaction.dispute(1, 1));
        applied(Transaction.chargeback(1, 1));

        assertBalances("7.25", "0", "7.25");
        rejected(Transaction.withdrawal(1, 3, amt("7.25")), ApplyError.ACCOUNT_LOCKED);
        assertBalances("7.25", "0", "7.25");
    }

    @Test
    @DisplayName("Dispute of an unknown tx is rejected")
    void disputeUnknownTx() {
        rejected(Transaction.dispute(1, 999), ApplyError.UNKNOWN_TX);
        assertBalances("0", "0", "0");

        applied(Transaction.deposit(1, 1, amt("3")));
        rejected(Transaction.dispute(1, 999), ApplyError.UNKNOWN_TX);
        rejected(Transaction.resolve(1, 999), ApplyError.UNKNOWN_TX);
        rejected(Transaction.chargeback(1, 999), ApplyError.UNKNOWN_TX);
        assertBalances("3", "0", "3");
    }

    @Test
    void duplicateTxIdNeverMutates() {
        applied(Transaction.deposit(1, 1, amt("10")));

        rejected(Transaction.deposit(1, 1, amt("10")), ApplyError.DUPLICATE_TX_ID);
        rejected(Transaction.withdrawal(1, 1, amt("1")), ApplyError.DUPLICATE_TX_ID);
        assertBalances("10", "0", "10");

        applied(Transaction.withdrawal(1, 2, amt("4")));
        rejected(Transaction.withdrawal(1, 2, amt("4")), ApplyError.DUPLICATE_TX_ID);
        rejected(Transaction.deposit(1, 2, amt("4")), ApplyError.DUPLICATE_TX_ID);
        assertBalances("6", "0", "6");
    }

    @Test
    void rejectedWithdrawalDoesNotReserveTxId() {
        applied(Transaction.deposit(1, 1, amt("1")));
        rejected(Transaction.withdrawal(1, 2, amt("5")), ApplyError.INSUFFICIENT_FUNDS);

        // 被拒的取款不登记流水，同号可以再次提交
        applied(Transaction.deposit(1, 2, amt("5")));
        assertBalances("6", "0", "6");
    }

    @Test
    void disputeStateTransitionsAreOneWay() {
        applied(Transaction.deposit(1, 1, amt("10")));

        rejected(Transaction.resolve(1, 1), ApplyError.INVALID_DISPUTE_STATE);
        rejected(Transaction.chargeback(1, 1), ApplyError.INVALID_DISPUTE_STATE);

        applied(Transaction.dispute(1, 1));
        rejected(Transaction.dispute(1, 1), ApplyError.INVALID_DISPUTE_STATE);

        applied(Transaction.resolve(1, 1));
        rejected(Transaction.resolve(1, 1), ApplyError.INVALID_DISPUTE_STATE);
        rejected(Transaction.dispute(1, 1), ApplyError.INVALID_DISPUTE_STATE);
        rejected(Transaction.chargeback(1, 1), ApplyError.INVALID_DISPUTE_STATE);

        assertBalances("10", "0", "10");
        assertFalse(account.isLocked());
    }

    @Test
    void disputeAfterFundsWereWithdrawnIsRejected() {
        applied(Transaction.deposit(1, 1, amt("10")));
        applied(Transaction.withdrawal(1, 2, amt("8")));

        rejected(Transaction.dispute(1, 1), ApplyError.INSUFFICIENT_FUNDS);

        assertBalances("2", "0", "2");
        assertEquals(DisputeStatus.NORMAL, account.findEntry(1).orElseThrow().getStatus());
    }

    @Test
    @DisplayName("Default policy: withdrawals cannot be disputed")
    void withdrawalNotDisputableByDefault() {
        applied(Transaction.deposit(1, 1, amt("10")));
        applied(Transaction.withdrawal(1, 2, amt("4")));

        rejected(Transaction.dispute(1, 2), ApplyError.INVALID_DISPUTE_STATE);

        assertBalances("6", "0", "6");
        assertEquals(DisputeStatus.NORMAL, account.findEntry(2).orElseThrow().getStatus());
    }

    @Test
    @DisplayName("Permissive policy: withdrawals can be disputed and resolved")
    void withdrawalDisputableWhenPolicyAllows() {
        account = new Account(1, DisputePolicy.DEPOSITS_AND_WITHDRAWALS);
        applied(Transaction.deposit(1, 1, amt("10")));
        applied(Transaction.withdrawal(1, 2, amt("4")));

        applied(Transaction.dispute(1, 2));
        assertBalances("2", "4", "6");

        applied(Transaction.resolve(1, 2));
        assertBalances("6", "0", "6");
    }

    @Test
    void withdrawalChargebackUnderPermissivePolicy() {
        account = new Account(1, DisputePolicy.DEPOSITS_AND_WITHDRAWALS);
        applied(Transaction.deposit(1, 1, amt("10")));
        applied(Transaction.withdrawal(1, 2, amt("4")));
        applied(Transaction.dispute(1, 2));
        applied(Transaction.chargeback(1, 2));

        assertBalances("2", "0", "2");
        assertTrue(account.isLocked());
    }

    @Test
    void fractionalAmountsStayExact() {
        applied(Transaction.deposit(1, 1, amt("0.1")));
        applied(Transaction.deposit(1, 2, amt("0.2")));
        applied(Transaction.withdrawal(1, 3, amt("0.3")));

        assertBalances("0", "0", "0");
    }

    @Test
    void snapshotCopiesState() {
        applied(Transaction.deposit(1, 1, amt("10")));
        applied(Transaction.dispute(1, 1));

        AccountSnapshot snapshot = account.snapshot();
        applied(Transaction.resolve(1, 1));

        assertEquals(1, snapshot.getClientId());
        assertEquals(0, snapshot.getAvailable().signum());
        assertEquals(0, amt("10").compareTo(snapshot.getHeld()));
        assertEquals(0, amt("10").compareTo(snapshot.getTotal()));
        assertFalse(snapshot.isLocked());
    }
}
