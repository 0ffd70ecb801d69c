package com.flagship.credits_ledger.money;

import com.flagship.credits_ledger.exception.CreditsValidationException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Converts between decimal display amounts and integer minor units.
 *
 * Stored amounts are always whole minor units (one credit = 100 minor units).
 * Conversion goes through {@link BigDecimal} only; binary floating point never
 * touches a stored value.
 */
public final class MoneyCodec {

    /**
     * Number of fractional digits of one credit.
     */
    public static final int SCALE = 2;

    /**
     * Half away from zero, so 0.005 becomes 1 and -0.005 becomes -1.
     */
    public static final RoundingMode ROUNDING_MODE = RoundingMode.HALF_UP;

    private MoneyCodec() {
        // Utility class
    }

    /**
     * Converts a decimal amount to minor units, rounding half away from zero.
     *
     * @param decimalAmount amount in whole credits, e.g. {@code 12.345}
     * @return amount in minor units, e.g. {@code 1235}
     * @throws CreditsValidationException if the amount is null or does not fit in a long
     */
    public static long toMinorUnits(BigDecimal decimalAmount) {
        if (decimalAmount == null) {
            throw new CreditsValidationException("Amount is required");
        }
        try {
            return decimalAmount.movePointRight(SCALE)
                    .setScale(0, ROUNDING_MODE)
                    .longValueExact();
        } catch (ArithmeticException e) {
            throw new CreditsValidationException("Amount out of range: " + decimalAmount.toPlainString(), e);
        }
    }

    /**
     * Parses a decimal string and converts it to minor units.
     */
    public static long toMinorUnits(String decimalAmount) {
        if (decimalAmount == null || decimalAmount.isBlank()) {
            throw new CreditsValidationException("Amount is required");
        }
        try {
            return toMinorUnits(new BigDecimal(decimalAmount.trim()));
        } catch (NumberFormatException e) {
            throw new CreditsValidationException("Invalid amount format: " + decimalAmount, e);
        }
    }

    /**
     * Formats minor units as a plain decimal string with two fractional digits.
     * {@code 1250 -> "12.50"}, {@code -5 -> "-0.05"}, {@code 0 -> "0.00"}.
     */
    public static String toDecimalString(long minorUnits) {
        return BigDecimal.valueOf(minorUnits, SCALE).toPlainString();
    }
}
