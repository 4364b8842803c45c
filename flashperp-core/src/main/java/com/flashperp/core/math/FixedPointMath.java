package com.flashperp.core.math;

import com.flashperp.core.model.Side;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Fixed-point arithmetic for margin, PnL, funding and liquidation.
 *
 * Prices, sizes and collateral are longs scaled by {@link #PRICE_SCALE} (8 fractional digits).
 * Rates are basis points (1/10000). Intermediate products are computed in {@link BigInteger}
 * so they cannot wrap; results that do not fit a long throw {@link ArithmeticException}.
 * Integer division truncates toward zero.
 */
public final class FixedPointMath {

    /** 1e8: one whole unit of price, size or collateral. */
    public static final long PRICE_SCALE = 100_000_000L;

    /** Divisor for basis-point rates. */
    public static final long BPS_DIVISOR = 10_000L;

    private static final BigInteger SCALE = BigInteger.valueOf(PRICE_SCALE);
    private static final BigInteger BPS = BigInteger.valueOf(BPS_DIVISOR);

    private FixedPointMath() {
    }

    /**
     * Convert a whole-unit amount to its fixed-point representation.
     */
    public static long units(long wholeUnits) {
        return Math.multiplyExact(wholeUnits, PRICE_SCALE);
    }

    /**
     * Fixed-point representation of a decimal amount, truncating digits beyond the eighth.
     */
    public static long fromDecimal(BigDecimal value) {
        return value.movePointRight(8).setScale(0, RoundingMode.DOWN).longValueExact();
    }

    /**
     * Decimal value of a fixed-point amount.
     */
    public static BigDecimal toDecimal(long fixedPoint) {
        return BigDecimal.valueOf(fixedPoint, 8);
    }

    /**
     * Notional value: {@code size * price / PRICE_SCALE}.
     */
    public static long notional(long size, long price) {
        requireNonNegative(size, "size");
        requireNonNegative(price, "price");
        return exact(big(size).multiply(big(price)).divide(SCALE));
    }

    /**
     * Margin required for a notional at a basis-point rate: {@code notional * rateBps / 10000}.
     */
    public static long requiredMargin(long notional, long rateBps) {
        requireNonNegative(notional, "notional");
        requireNonNegative(rateBps, "rateBps");
        return exact(big(notional).multiply(big(rateBps)).divide(BPS));
    }

    /**
     * Signed profit and loss of {@code size} held from {@code entryPrice} to {@code currentPrice}.
     * Longs profit when the price rises, shorts when it falls.
     */
    public static long pnl(long size, long entryPrice, long currentPrice, Side side) {
        requireNonNegative(size, "size");
        requireNonNegative(entryPrice, "entryPrice");
        requireNonNegative(currentPrice, "currentPrice");

        BigInteger delta = big(currentPrice).subtract(big(entryPrice));
        BigInteger magnitude = big(size).multiply(delta.abs()).divide(SCALE);
        boolean profit = side.isLong() ? delta.signum() > 0 : delta.signum() < 0;
        return exact(profit ? magnitude : magnitude.negate());
    }

    /**
     * Funding rate in basis points per interval from the mark/index divergence:
     * {@code sign(mark - index) * |mark - index| * factor / index}.
     *
     * @throws IllegalArgumentException if {@code index} is zero
     */
    public static long fundingRate(long markPrice, long indexPrice, long factor) {
        if (indexPrice == 0) {
            throw new IllegalArgumentException("index price must not be zero");
        }
        requireNonNegative(markPrice, "markPrice");
        requireNonNegative(indexPrice, "indexPrice");
        requireNonNegative(factor, "factor");

        BigInteger delta = big(markPrice).subtract(big(indexPrice));
        BigInteger magnitude = delta.abs().multiply(big(factor)).divide(big(indexPrice));
        return exact(delta.signum() < 0 ? magnitude.negate() : magnitude);
    }

    /**
     * Funding owed by a position for one application of {@code rateBps}.
     *
     * @return positive when the position pays (subtract from collateral), negative when it receives.
     *         Longs pay when the rate is positive, shorts pay when it is negative.
     */
    public static long fundingPayment(long size, long rateBps, Side side) {
        requireNonNegative(size, "size");
        BigInteger magnitude = big(size).multiply(big(rateBps).abs()).divide(BPS);
        boolean pays = side.isLong() ? rateBps > 0 : rateBps < 0;
        return exact(pays ? magnitude : magnitude.negate());
    }

    /**
     * Price at which {@code collateral + pnl} equals the maintenance margin on the notional at that price.
     * <p>
     * Long: returns 0 when the collateral is already below the maintenance margin at the entry price,
     * and never returns a negative price. Short: strictly above the entry price for a position that is
     * solvent at entry; a short already under-margined at entry returns {@code entryPrice}.
     *
     * @throws IllegalArgumentException if {@code size} is zero
     */
    public static long liquidationPrice(long size, long collateral, long entryPrice,
                                        long maintenanceRateBps, Side side) {
        if (size == 0) {
            throw new IllegalArgumentException("size must not be zero");
        }
        requireNonNegative(size, "size");
        requireNonNegative(entryPrice, "entryPrice");
        requireNonNegative(maintenanceRateBps, "maintenanceRateBps");
        if (maintenanceRateBps >= BPS_DIVISOR) {
            throw new IllegalArgumentException("maintenance rate must be below 10000 bps: " + maintenanceRateBps);
        }

        long entryNotional = notional(size, entryPrice);
        long marginAtEntry = requiredMargin(entryNotional, maintenanceRateBps);
        boolean solventAtEntry = collateral >= marginAtEntry;

        // collateral + s*(P - E)/S = r*s*P/(S*10000), solved for P
        if (side.isLong()) {
            if (!solventAtEntry) {
                return 0;
            }
            BigInteger numerator = big(entryNotional).subtract(big(collateral));
            if (numerator.signum() <= 0) {
                return 0;
            }
            BigInteger price = numerator.multiply(SCALE).multiply(BPS)
                    .divide(big(size).multiply(BPS.subtract(big(maintenanceRateBps))));
            return exact(price);
        }

        if (!solventAtEntry || collateral == marginAtEntry) {
            return entryPrice;
        }
        BigInteger numerator = big(collateral).add(big(entryNotional));
        BigInteger price = numerator.multiply(SCALE).multiply(BPS)
                .divide(big(size).multiply(BPS.add(big(maintenanceRateBps))));
        // truncation can land on the entry price itself
        return Math.max(exact(price), Math.addExact(entryPrice, 1));
    }

    /**
     * Fee charged on a notional at a basis-point rate.
     */
    public static long tradingFee(long notional, long feeBps) {
        return requiredMargin(notional, feeBps);
    }

    /**
     * {@code amount * part / whole}, rounded down. Used for proportional collateral release.
     *
     * @throws IllegalArgumentException if {@code whole} is zero
     */
    public static long proportional(long amount, long part, long whole) {
        if (whole == 0) {
            throw new IllegalArgumentException("whole must not be zero");
        }
        BigInteger[] quotientAndRemainder = big(amount).multiply(big(part)).divideAndRemainder(big(whole));
        BigInteger quotient = quotientAndRemainder[0];
        BigInteger remainder = quotientAndRemainder[1];
        if (remainder.signum() != 0 && remainder.signum() != Long.signum(whole)) {
            quotient = quotient.subtract(BigInteger.ONE);
        }
        return exact(quotient);
    }

    /**
     * Size-weighted average of two entry prices.
     */
    public static long weightedEntryPrice(long oldEntry, long oldSize, long addedPrice, long addedSize) {
        long newSize = Math.addExact(oldSize, addedSize);
        if (newSize == 0) {
            throw new IllegalArgumentException("combined size must not be zero");
        }
        BigInteger weighted = big(oldEntry).multiply(big(oldSize)).add(big(addedPrice).multiply(big(addedSize)));
        return exact(weighted.divide(big(newSize)));
    }

    /**
     * Whether {@code actual} lies within {@code toleranceBps} of {@code reference}.
     */
    public static boolean withinSlippage(long reference, long actual, long toleranceBps) {
        requireNonNegative(reference, "reference");
        requireNonNegative(toleranceBps, "toleranceBps");
        BigInteger deviation = big(actual).subtract(big(reference)).abs().multiply(BPS);
        BigInteger allowed = big(toleranceBps).multiply(big(reference));
        return deviation.compareTo(allowed) <= 0;
    }

    private static void requireNonNegative(long value, String name) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must not be negative: " + value);
        }
    }

    private static BigInteger big(long value) {
        return BigInteger.valueOf(value);
    }

    private static long exact(BigInteger value) {
        return value.longValueExact();
    }
}
