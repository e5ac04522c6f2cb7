package in.ledgerguard.infrastructure.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Ledger Schema Migration - creates the ledger tables on startup.
 *
 * Creates three tables:
 * - trade_ledger: active records, one JSONB document per trade
 * - trade_ledger_archive: records moved out by the retention sweep
 * - trade_ledger_meta: key/value metadata (last_updated)
 */
public final class LedgerSchemaMigration {
    private static final Logger log = LoggerFactory.getLogger(LedgerSchemaMigration.class);

    private final DataSource dataSource;

    public LedgerSchemaMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Run migration - creates tables that don't exist yet.
     */
    public void migrate() {
        log.info("[LEDGER MIGRATION] Starting ledger schema migration");

        try (Connection conn = dataSource.getConnection()) {
            if (!tableExists(conn, "trade_ledger")) {
                log.info("[LEDGER MIGRATION] Creating trade_ledger table...");
                createLedgerTable(conn, "trade_ledger", "updated_at");
                execute(conn, "CREATE INDEX idx_trade_ledger_strategy_status ON trade_ledger (strategy_name, status)");
                execute(conn, "CREATE INDEX idx_trade_ledger_symbol ON trade_ledger (symbol)");
            } else {
                log.info("[LEDGER MIGRATION] trade_ledger table already exists");
            }

            if (!tableExists(conn, "trade_ledger_archive")) {
                log.info("[LEDGER MIGRATION] Creating trade_ledger_archive table...");
                createLedgerTable(conn, "trade_ledger_archive", "archived_at");
            } else {
                log.info("[LEDGER MIGRATION] trade_ledger_archive table already exists");
            }

            if (!tableExists(conn, "trade_ledger_meta")) {
                log.info("[LEDGER MIGRATION] Creating trade_ledger_meta table...");
                execute(conn, """
                    CREATE TABLE trade_ledger_meta (
                        key VARCHAR(64) PRIMARY KEY,
                        value TEXT NOT NULL
                    )
                    """);
            }

            log.info("[LEDGER MIGRATION] Migration completed successfully");

        } catch (SQLException e) {
            log.error("[LEDGER MIGRATION] Migration failed: {}", e.getMessage(), e);
            throw new LedgerStorageException("Ledger migration failed", e);
        }
    }

    private boolean tableExists(Connection conn, String tableName) throws SQLException {
        DatabaseMetaData metadata = conn.getMetaData();
        try (ResultSet rs = metadata.getTables(null, null, tableName, new String[]{"TABLE"})) {
            return rs.next();
        }
    }

    private void createLedgerTable(Connection conn, String table, String timestampColumn) throws SQLException {
        execute(conn, """
            CREATE TABLE %s (
                trade_id VARCHAR(64) PRIMARY KEY,
                strategy_name VARCHAR(128) NOT NULL,
                symbol VARCHAR(64) NOT NULL,
                status VARCHAR(20) NOT NULL,
                entry_time TIMESTAMPTZ,
                document JSONB NOT NULL,
                %s TIMESTAMPTZ NOT NULL DEFAULT NOW()
            )
            """.formatted(table, timestampColumn));
    }

    private void execute(Connection conn, String sql) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
        }
    }
}
