package in.ledgerguard.domain.trade;

/**
 * Record as held by the ledger after a write, plus how it was persisted.
 */
public record LedgerWrite(TradeRecord record, WriteOutcome outcome) {

    public boolean isEmergency() {
        return outcome == WriteOutcome.EMERGENCY;
    }
}
