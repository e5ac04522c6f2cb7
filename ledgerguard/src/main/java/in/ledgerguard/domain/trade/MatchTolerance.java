package in.ledgerguard.domain.trade;

import java.math.BigDecimal;

/**
 * Tolerance used to pair ledger records with exchange positions.
 *
 * A value matches a target when {@code |value - target| <= max(target * relative, floor)}.
 */
public record MatchTolerance(BigDecimal relative, BigDecimal quantityFloor, BigDecimal priceFloor) {

    public static final MatchTolerance DEFAULT =
        new MatchTolerance(new BigDecimal("0.01"), new BigDecimal("0.001"), new BigDecimal("0.01"));

    public static MatchTolerance withRelative(BigDecimal relative) {
        return new MatchTolerance(relative, DEFAULT.quantityFloor, DEFAULT.priceFloor);
    }

    public boolean quantityMatches(BigDecimal value, BigDecimal target) {
        return within(value, target, quantityFloor);
    }

    public boolean priceMatches(BigDecimal value, BigDecimal target) {
        return within(value, target, priceFloor);
    }

    private boolean within(BigDecimal value, BigDecimal target, BigDecimal floor) {
        if (value == null || target == null) {
            return false;
        }
        BigDecimal allowed = target.abs().multiply(relative).max(floor);
        return value.subtract(target).abs().compareTo(allowed) <= 0;
    }
}
