package in.ledgerguard.application.port.output;

import in.ledgerguard.domain.trade.TradeRecord;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable storage for trade records.
 *
 * Implementations serialize their own writes. {@link #read} must go to the durable
 * medium, never to a write-through cache, so callers can verify what was persisted.
 */
public interface LedgerRepository {

    /**
     * Load every active (non-archived) record.
     *
     * @return records keyed by trade id; empty when the store does not exist yet
     */
    Map<String, TradeRecord> loadAll();

    /**
     * Read one record back from durable storage.
     */
    Optional<TradeRecord> read(String tradeId);

    /**
     * Insert or replace a record and bump {@code last_updated}.
     */
    void write(TradeRecord record);

    /**
     * Move records into the archive collection. Records already archived are skipped.
     *
     * @return number of records moved
     */
    int archive(Collection<TradeRecord> records);

    List<TradeRecord> loadArchive();

    /**
     * Time of the last successful write, or null for a new store.
     */
    Instant lastUpdated();
}
