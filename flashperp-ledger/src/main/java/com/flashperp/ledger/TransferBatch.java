package com.flashperp.ledger;

import com.flashperp.ledger.custody.Custody;
import com.flashperp.ledger.custody.CustodyException;
import com.flashperp.ledger.custody.InsufficientBalanceException;
import com.flashperp.ledger.custody.UnsupportedAssetException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Custody transfers made by one ledger operation. If a later step fails the operation calls
 * {@link #rollback()}, which reverses the completed transfers newest first.
 */
class TransferBatch {

    private static final Logger log = LoggerFactory.getLogger(TransferBatch.class);

    private record Transfer(boolean debit, String account, long amount) {}

    private final Custody custody;
    private final String asset;
    private final Deque<Transfer> completed = new ArrayDeque<>();

    TransferBatch(Custody custody, String asset) {
        this.custody = custody;
        this.asset = asset;
    }

    void debit(String account, long amount) throws InsufficientBalanceException, UnsupportedAssetException {
        if (amount <= 0) {
            return;
        }
        custody.debit(account, asset, amount);
        completed.push(new Transfer(true, account, amount));
    }

    void credit(String account, long amount) throws UnsupportedAssetException {
        if (amount <= 0) {
            return;
        }
        custody.credit(account, asset, amount);
        completed.push(new Transfer(false, account, amount));
    }

    void rollback() {
        while (!completed.isEmpty()) {
            Transfer t = completed.pop();
            try {
                if (t.debit()) {
                    custody.credit(t.account(), asset, t.amount());
                } else {
                    custody.debit(t.account(), asset, t.amount());
                }
            } catch (CustodyException e) {
                log.error("Failed to reverse {} of {} {} for {}: {}",
                        t.debit() ? "debit" : "credit", t.amount(), asset, t.account(), e.getMessage());
            }
        }
    }
}
