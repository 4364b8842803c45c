package com.flashperp.ledger.custody;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for InMemoryCustody and its exchange access handle.
 */
class InMemoryCustodyTest {

    private InMemoryCustody custody;

    @BeforeEach
    void setUp() throws Exception {
        custody = new InMemoryCustody();
        custody.addSupportedAsset("USDC");
        custody.deposit("alice", "USDC", 1_000);
    }

    @Nested
    @DisplayName("Deposits and Withdrawals")
    class DepositsAndWithdrawals {

        @Test
        @DisplayName("Deposit and withdraw adjust the balance")
        void depositWithdraw() throws Exception {
            custody.withdraw("alice", "USDC", 400);
            assertEquals(600, custody.balanceOf("alice", "USDC"));
        }

        @Test
        @DisplayName("Withdrawing more than the balance fails")
        void overdraw() {
            InsufficientBalanceException e = assertThrows(InsufficientBalanceException.class,
                () -> custody.withdraw("alice", "USDC", 1_001));
            assertEquals(1_000, e.getAvailable());
            assertEquals(1_001, e.getRequested());
            assertEquals(1_000, custody.balanceOf("alice", "USDC"));
        }

        @Test
        @DisplayName("Unsupported asset is rejected")
        void unsupportedAsset() {
            assertThrows(UnsupportedAssetException.class, () -> custody.deposit("alice", "DOGE", 1));
            assertThrows(UnsupportedAssetException.class, () -> custody.setCollateralAsset("ETH-PERP", "DOGE"));
        }

        @Test
        @DisplayName("Unknown account has zero balance")
        void unknownAccount() {
            assertEquals(0, custody.balanceOf("nobody", "USDC"));
        }
    }

    @Nested
    @DisplayName("Exchange Access")
    class ExchangeAccess {

        @Test
        @DisplayName("Access can be issued only once")
        void issuedOnce() {
            custody.issueExchangeAccess();
            assertThrows(IllegalStateException.class, () -> custody.issueExchangeAccess());
        }

        @Test
        @DisplayName("Debit moves funds into the pool, credit moves them out")
        void debitCredit() throws Exception {
            Custody access = custody.issueExchangeAccess();

            access.debit("alice", "USDC", 300);
            assertEquals(700, custody.balanceOf("alice", "USDC"));
            assertEquals(300, custody.poolBalance("USDC"));

            access.credit("bob", "USDC", 100);
            assertEquals(100, custody.balanceOf("bob", "USDC"));
            assertEquals(200, custody.poolBalance("USDC"));
        }

        @Test
        @DisplayName("Debit beyond the balance leaves everything unchanged")
        void debitInsufficient() {
            Custody access = custody.issueExchangeAccess();

            assertThrows(InsufficientBalanceException.class, () -> access.debit("alice", "USDC", 2_000));
            assertEquals(1_000, custody.balanceOf("alice", "USDC"));
            assertEquals(0, custody.poolBalance("USDC"));
        }

        @Test
        @DisplayName("Credits beyond the pool drive it negative")
        void poolGoesNegative() throws Exception {
            Custody access = custody.issueExchangeAccess();
            access.credit("alice", "USDC", 50);
            assertEquals(-50, custody.poolBalance("USDC"));
        }

        @Test
        @DisplayName("Collateral asset must be configured per instrument")
        void collateralAsset() throws Exception {
            Custody access = custody.issueExchangeAccess();
            assertThrows(AssetNotConfiguredException.class, () -> access.collateralAssetFor("ETH-PERP"));

            custody.setCollateralAsset("ETH-PERP", "USDC");
            assertEquals("USDC", access.collateralAssetFor("ETH-PERP"));
        }
    }
}
