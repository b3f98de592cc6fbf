package microservices.helper.monkeyregistry.repository;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Normalizes the arbitrary-precision numbers DynamoDB returns into plain Java numbers:
 * whole values become {@link Integer}, {@link Long} or {@link BigInteger} (smallest that fits),
 * anything with a fractional part becomes {@link Double}.
 */
public final class NumericValues {

    private NumericValues() {
    }

    public static Number normalize(String value) {
        return normalize(new BigDecimal(value.trim()));
    }

    public static Number normalize(BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        if (stripped.scale() > 0) {
            return value.doubleValue();
        }
        BigInteger whole = stripped.toBigIntegerExact();
        if (whole.bitLength() < Integer.SIZE) {
            return whole.intValue();
        }
        if (whole.bitLength() < Long.SIZE) {
            return whole.longValue();
        }
        return whole;
    }
}
