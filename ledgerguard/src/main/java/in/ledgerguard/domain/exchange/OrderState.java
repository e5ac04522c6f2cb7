package in.ledgerguard.domain.exchange;

/**
 * Exchange-side order state as seen by the engine.
 */
public enum OrderState {
    PENDING,
    FILLED,
    REJECTED;

    public boolean isFinal() {
        return this != PENDING;
    }
}
