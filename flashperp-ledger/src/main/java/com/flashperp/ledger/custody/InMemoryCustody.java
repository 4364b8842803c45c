package com.flashperp.ledger.custody;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Balance book for traders and the exchange pool, kept in memory.
 * <p>
 * Deposits and withdrawals are open to everyone. Transfers between traders and the pool are only
 * reachable through the single {@link Custody} handle returned by {@link #issueExchangeAccess()}.
 */
public class InMemoryCustody {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCustody.class);

    private final Set<String> supportedAssets = ConcurrentHashMap.newKeySet();
    private final Map<String, String> collateralByInstrument = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Long>> balances = new HashMap<>();
    private final Map<String, Long> pool = new HashMap<>();
    private boolean accessIssued;

    public void addSupportedAsset(String asset) {
        supportedAssets.add(asset);
        log.info("Custody asset added: {}", asset);
    }

    public boolean isSupported(String asset) {
        return supportedAssets.contains(asset);
    }

    public void setCollateralAsset(String instrument, String asset) throws UnsupportedAssetException {
        requireSupported(asset);
        collateralByInstrument.put(instrument, asset);
        log.info("Collateral for {} set to {}", instrument, asset);
    }

    public synchronized void deposit(String owner, String asset, long amount) throws UnsupportedAssetException {
        requireSupported(asset);
        requirePositive(amount);
        balances.computeIfAbsent(owner, k -> new HashMap<>()).merge(asset, amount, Math::addExact);
    }

    public synchronized void withdraw(String owner, String asset, long amount)
            throws UnsupportedAssetException, InsufficientBalanceException {
        requireSupported(asset);
        requirePositive(amount);
        long available = balanceOf(owner, asset);
        if (available < amount) {
            throw new InsufficientBalanceException(
                    String.format("Insufficient balance for %s: need %d %s, have %d", owner, amount, asset, available),
                    available, amount);
        }
        balances.get(owner).put(asset, available - amount);
    }

    public synchronized long balanceOf(String owner, String asset) {
        Map<String, Long> ownerBalances = balances.get(owner);
        return ownerBalances == null ? 0 : ownerBalances.getOrDefault(asset, 0L);
    }

    /**
     * Collateral currently held by the exchange. Goes negative if profits paid out exceed deposits.
     */
    public synchronized long poolBalance(String asset) {
        return pool.getOrDefault(asset, 0L);
    }

    /**
     * Hand out the transfer capability. Can be called once.
     */
    public synchronized Custody issueExchangeAccess() {
        if (accessIssued) {
            throw new IllegalStateException("Exchange access already issued");
        }
        accessIssued = true;
        return new ExchangeAccess();
    }

    private void requireSupported(String asset) throws UnsupportedAssetException {
        if (asset == null || !supportedAssets.contains(asset)) {
            throw new UnsupportedAssetException(asset);
        }
    }

    private static void requirePositive(long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("amount must be positive: " + amount);
        }
    }

    private final class ExchangeAccess implements Custody {

        @Override
        public void debit(String owner, String asset, long amount)
                throws InsufficientBalanceException, UnsupportedAssetException {
            synchronized (InMemoryCustody.this) {
                requireSupported(asset);
                requirePositive(amount);
                long available = balanceOf(owner, asset);
                if (available < amount) {
                    throw new InsufficientBalanceException(
                            String.format("Insufficient balance for %s: need %d %s, have %d",
                                    owner, amount, asset, available),
                            available, amount);
                }
                balances.get(owner).put(asset, available - amount);
                pool.merge(asset, amount, Math::addExact);
            }
        }

        @Override
        public void credit(String owner, String asset, long amount) throws UnsupportedAssetException {
            synchronized (InMemoryCustody.this) {
                requireSupported(asset);
                requirePositive(amount);
                long poolBefore = pool.getOrDefault(asset, 0L);
                pool.put(asset, Math.subtractExact(poolBefore, amount));
                balances.computeIfAbsent(owner, k -> new HashMap<>()).merge(asset, amount, Math::addExact);
                if (poolBefore < amount) {
                    log.warn("Exchange pool for {} is short after crediting {} to {} (pool={})",
                            asset, amount, owner, poolBefore - amount);
                }
            }
        }

        @Override
        public String collateralAssetFor(String instrument) throws AssetNotConfiguredException {
            String asset = collateralByInstrument.get(instrument);
            if (asset == null) {
                throw new AssetNotConfiguredException(instrument);
            }
            return asset;
        }
    }
}
