package in.ledgerguard.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import in.ledgerguard.application.port.output.LedgerRepository;
import in.ledgerguard.domain.trade.TradeRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * PostgreSQL ledger. One JSONB document per trade plus indexed lookup columns.
 *
 * Tables are created by {@link LedgerSchemaMigration}.
 */
public final class PostgresLedgerRepository implements LedgerRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresLedgerRepository.class);

    private static final String META_LAST_UPDATED = "last_updated";

    private final DataSource dataSource;
    private final Clock clock;

    public PostgresLedgerRepository(DataSource dataSource) {
        this(dataSource, Clock.systemUTC());
    }

    public PostgresLedgerRepository(DataSource dataSource, Clock clock) {
        this.dataSource = dataSource;
        this.clock = clock;
    }

    @Override
    public Map<String, TradeRecord> loadAll() {
        String sql = """
            SELECT trade_id, document::text AS document FROM trade_ledger
            ORDER BY entry_time
            """;

        Map<String, TradeRecord> trades = new LinkedHashMap<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {

            while (rs.next()) {
                String tradeId = rs.getString("trade_id");
                try {
                    trades.put(tradeId, fromJson(rs.getString("document")));
                } catch (JsonProcessingException e) {
                    log.error("Skipping unreadable ledger row {}: {}", tradeId, e.getMessage());
                }
            }
        } catch (SQLException e) {
            log.error("Failed to load ledger: {}", e.getMessage());
            throw new LedgerStorageException("Failed to load ledger", e);
        }
        log.info("Ledger loaded from trade_ledger: {} records", trades.size());
        return trades;
    }

    @Override
    public Optional<TradeRecord> read(String tradeId) {
        String sql = """
            SELECT document::text AS document FROM trade_ledger
            WHERE trade_id = ?
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, tradeId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(fromJson(rs.getString("document")));
                }
            }
        } catch (SQLException | JsonProcessingException e) {
            log.error("Failed to read trade {}: {}", tradeId, e.getMessage());
            throw new LedgerStorageException("Failed to read trade " + tradeId, e);
        }
        return Optional.empty();
    }

    @Override
    public void write(TradeRecord record) {
        String upsert = """
            INSERT INTO trade_ledger (trade_id, strategy_name, symbol, status, entry_time, document, updated_at)
            VALUES (?, ?, ?, ?, ?, ?::jsonb, ?)
            ON CONFLICT (trade_id) DO UPDATE SET
                strategy_name = EXCLUDED.strategy_name,
                symbol = EXCLUDED.symbol,
                status = EXCLUDED.status,
                entry_time = EXCLUDED.entry_time,
                document = EXCLUDED.document,
                updated_at = EXCLUDED.updated_at
            """;

        Instant now = clock.instant();
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement ps = conn.prepareStatement(upsert)) {
                ps.setString(1, record.tradeId());
                ps.setString(2, record.strategyName());
                ps.setString(3, record.symbol());
                ps.setString(4, record.status().name());
                ps.setTimestamp(5, record.entryTime() != null ? Timestamp.from(record.entryTime()) : null);
                ps.setString(6, toJson(record));
                ps.setTimestamp(7, Timestamp.from(now));
                ps.executeUpdate();

                touchLastUpdated(conn, now);
                conn.commit();
            } catch (SQLException | JsonProcessingException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException | JsonProcessingException e) {
            log.error("Failed to write trade {}: {}", record.tradeId(), e.getMessage());
            throw new LedgerStorageException("Failed to write trade " + record.tradeId(), e);
        }
    }

    @Override
    public int archive(Collection<TradeRecord> records) {
        if (records.isEmpty()) {
            return 0;
        }

        String insert = """
            INSERT INTO trade_ledger_archive (trade_id, strategy_name, symbol, status, entry_time, document, archived_at)
            VALUES (?, ?, ?, ?, ?, ?::jsonb, ?)
            ON CONFLICT (trade_id) DO NOTHING
            """;
        String delete = "DELETE FROM trade_ledger WHERE trade_id = ?";

        Instant now = clock.instant();
        int moved = 0;
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement ins = conn.prepareStatement(insert);
                 PreparedStatement del = conn.prepareStatement(delete)) {

                for (TradeRecord record : records) {
                    ins.setString(1, record.tradeId());
                    ins.setString(2, record.strategyName());
                    ins.setString(3, record.symbol());
                    ins.setString(4, record.status().name());
                    ins.setTimestamp(5, record.entryTime() != null ? Timestamp.from(record.entryTime()) : null);
                    ins.setString(6, toJson(record));
                    ins.setTimestamp(7, Timestamp.from(now));
                    ins.executeUpdate();

                    del.setString(1, record.tradeId());
                    moved += del.executeUpdate();
                }
                touchLastUpdated(conn, now);
                conn.commit();
            } catch (SQLException | JsonProcessingException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException | JsonProcessingException e) {
            log.error("Failed to archive {} trades: {}", records.size(), e.getMessage());
            throw new LedgerStorageException("Failed to archive trades", e);
        }

        log.info("Archived {} trades to trade_ledger_archive", moved);
        return moved;
    }

    @Override
    public List<TradeRecord> loadArchive() {
        String sql = """
            SELECT trade_id, document::text AS document FROM trade_ledger_archive
            ORDER BY entry_time
            """;

        List<TradeRecord> archived = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {

            while (rs.next()) {
                archived.add(fromJson(rs.getString("document")));
            }
        } catch (SQLException | JsonProcessingException e) {
            log.error("Failed to load archive: {}", e.getMessage());
            throw new LedgerStorageException("Failed to load archive", e);
        }
        return archived;
    }

    @Override
    public Instant lastUpdated() {
        String sql = "SELECT value FROM trade_ledger_meta WHERE key = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, META_LAST_UPDATED);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Instant.parse(rs.getString("value"));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to read last_updated: {}", e.getMessage());
            throw new LedgerStorageException("Failed to read ledger metadata", e);
        }
        return null;
    }

    private void touchLastUpdated(Connection conn, Instant now) throws SQLException {
        String sql = """
            INSERT INTO trade_ledger_meta (key, value) VALUES (?, ?)
            ON CONFLICT (key) DO UPDATE SET value = EXCLUDED.value
            """;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, META_LAST_UPDATED);
            ps.setString(2, now.toString());
            ps.executeUpdate();
        }
    }

    private static String toJson(TradeRecord record) throws JsonProcessingException {
        return LedgerJson.MAPPER.writeValueAsString(record);
    }

    private static TradeRecord fromJson(String json) throws JsonProcessingException {
        return LedgerJson.MAPPER.readValue(json, TradeRecord.class);
    }
}
