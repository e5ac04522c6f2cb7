package in.ledgerguard.application.service;

import in.ledgerguard.domain.trade.Pnl;
import in.ledgerguard.domain.trade.PositionSide;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class PnlCalculatorTest {

    private static BigDecimal bd(String value) {
        return new BigDecimal(value);
    }

    @Test
    void testLongProfit() {
        Pnl pnl = PnlCalculator.compute(PositionSide.LONG, bd("100"), bd("110"), bd("10"), bd("100"));

        assertEquals(0, bd("100").compareTo(pnl.absolute()));
        assertEquals(0, bd("100").compareTo(pnl.percentage()));
    }

    @Test
    void testShortProfitWhenPriceFalls() {
        Pnl pnl = PnlCalculator.compute(PositionSide.SHORT, bd("100"), bd("95"), bd("10"), bd("200"));

        assertEquals(0, bd("50").compareTo(pnl.absolute()));
        assertEquals(0, bd("25").compareTo(pnl.percentage()));
    }

    @Test
    void testLongLoss() {
        Pnl pnl = PnlCalculator.compute(PositionSide.LONG, bd("100"), bd("99"), bd("10"), bd("100"));

        assertEquals(0, bd("-10").compareTo(pnl.absolute()));
        assertEquals(0, bd("-10").compareTo(pnl.percentage()));
    }

    @Test
    void testMissingInputsYieldZero() {
        Pnl pnl = PnlCalculator.compute(PositionSide.LONG, null, bd("110"), bd("10"), bd("100"));

        assertEquals(0, BigDecimal.ZERO.compareTo(pnl.absolute()));
        assertEquals(0, BigDecimal.ZERO.compareTo(pnl.percentage()));
    }

    @Test
    void testZeroMarginGivesZeroPercentage() {
        Pnl pnl = PnlCalculator.compute(PositionSide.LONG, bd("100"), bd("110"), bd("1"), BigDecimal.ZERO);

        assertEquals(0, bd("10").compareTo(pnl.absolute()));
        assertEquals(0, BigDecimal.ZERO.compareTo(pnl.percentage()));
    }

    @Test
    void testMarginUsed() {
        assertEquals(0, bd("100").compareTo(PnlCalculator.marginUsed(bd("10"), bd("100"), 10)));
        assertEquals(0, bd("1000").compareTo(PnlCalculator.marginUsed(bd("10"), bd("100"), 0)),
            "Leverage below 1 counts as 1");
        assertNull(PnlCalculator.marginUsed(null, bd("100"), 5));
    }
}
