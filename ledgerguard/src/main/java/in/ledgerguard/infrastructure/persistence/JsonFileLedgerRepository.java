package in.ledgerguard.infrastructure.persistence;

import in.ledgerguard.application.port.output.LedgerRepository;
import in.ledgerguard.domain.trade.TradeRecord;
import in.ledgerguard.infrastructure.persistence.LedgerJson.LedgerDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ledger backed by a JSON document on disk.
 *
 * Every write rewrites the whole document to a temp file and atomically replaces the
 * ledger file, so a crash leaves either the old or the new version. Archived records
 * go to a second file with the same layout.
 *
 * THREAD-SAFETY: all methods are synchronized; writes are serialized.
 */
public final class JsonFileLedgerRepository implements LedgerRepository {
    private static final Logger log = LoggerFactory.getLogger(JsonFileLedgerRepository.class);

    private final Path ledgerFile;
    private final Path archiveFile;
    private final Clock clock;

    // Mirror of the ledger file used to build the next document
    private Map<String, TradeRecord> trades;
    private Instant lastUpdated;

    public JsonFileLedgerRepository(Path ledgerFile, Path archiveFile) {
        this(ledgerFile, archiveFile, Clock.systemUTC());
    }

    public JsonFileLedgerRepository(Path ledgerFile, Path archiveFile, Clock clock) {
        this.ledgerFile = ledgerFile;
        this.archiveFile = archiveFile;
        this.clock = clock;
    }

    @Override
    public synchronized Map<String, TradeRecord> loadAll() {
        LedgerDocument doc = loadOrEmpty(ledgerFile);
        this.trades = new LinkedHashMap<>(doc.trades());
        this.lastUpdated = doc.lastUpdated();
        log.info("Ledger loaded from {}: {} records, last_updated={}", ledgerFile, trades.size(), lastUpdated);
        return new LinkedHashMap<>(trades);
    }

    @Override
    public synchronized Optional<TradeRecord> read(String tradeId) {
        if (!Files.exists(ledgerFile)) {
            return Optional.empty();
        }
        try {
            LedgerDocument doc = LedgerJson.MAPPER.readValue(ledgerFile.toFile(), LedgerDocument.class);
            return Optional.ofNullable(doc.trades().get(tradeId));
        } catch (IOException e) {
            log.error("Failed to read back trade {} from {}: {}", tradeId, ledgerFile, e.getMessage());
            throw new LedgerStorageException("Failed to read ledger file " + ledgerFile, e);
        }
    }

    @Override
    public synchronized void write(TradeRecord record) {
        ensureLoaded();
        TradeRecord previous = trades.put(record.tradeId(), record);
        Instant previousUpdated = lastUpdated;
        lastUpdated = clock.instant();
        try {
            writeAtomically(ledgerFile, new LedgerDocument(trades, lastUpdated));
        } catch (IOException e) {
            if (previous == null) {
                trades.remove(record.tradeId());
            } else {
                trades.put(record.tradeId(), previous);
            }
            lastUpdated = previousUpdated;
            log.error("Failed to write trade {} to {}: {}", record.tradeId(), ledgerFile, e.getMessage());
            throw new LedgerStorageException("Failed to write ledger file " + ledgerFile, e);
        }
    }

    @Override
    public synchronized int archive(Collection<TradeRecord> records) {
        ensureLoaded();
        if (records.isEmpty()) {
            return 0;
        }

        LedgerDocument archive = loadOrEmpty(archiveFile);
        Map<String, TradeRecord> archived = new LinkedHashMap<>(archive.trades());
        int moved = 0;
        for (TradeRecord record : records) {
            archived.putIfAbsent(record.tradeId(), record);
            if (trades.containsKey(record.tradeId())) {
                moved++;
            }
        }

        try {
            // Archive first: a crash in between leaves a duplicate, never a loss
            writeAtomically(archiveFile, new LedgerDocument(archived, clock.instant()));
            Map<String, TradeRecord> remaining = new LinkedHashMap<>(trades);
            records.forEach(r -> remaining.remove(r.tradeId()));
            Instant now = clock.instant();
            writeAtomically(ledgerFile, new LedgerDocument(remaining, now));
            this.trades = remaining;
            this.lastUpdated = now;
        } catch (IOException e) {
            log.error("Failed to archive {} records: {}", records.size(), e.getMessage());
            throw new LedgerStorageException("Failed to archive ledger records", e);
        }

        log.info("Archived {} records to {}", moved, archiveFile);
        return moved;
    }

    @Override
    public synchronized List<TradeRecord> loadArchive() {
        return new ArrayList<>(loadOrEmpty(archiveFile).trades().values());
    }

    @Override
    public synchronized Instant lastUpdated() {
        ensureLoaded();
        return lastUpdated;
    }

    private void ensureLoaded() {
        if (trades == null) {
            loadAll();
        }
    }

    /**
     * Missing file: empty document. Unreadable file: moved aside and replaced by an empty document.
     */
    private LedgerDocument loadOrEmpty(Path file) {
        if (!Files.exists(file)) {
            log.info("Ledger file {} does not exist yet, starting empty", file);
            return LedgerDocument.empty();
        }
        try {
            LedgerDocument doc = LedgerJson.MAPPER.readValue(file.toFile(), LedgerDocument.class);
            return doc != null ? doc : LedgerDocument.empty();
        } catch (IOException e) {
            Path aside = file.resolveSibling(file.getFileName() + ".corrupt-" + clock.millis());
            log.error("Ledger file {} is unreadable ({}), starting empty; original kept as {}",
                file, e.getMessage(), aside);
            try {
                Files.move(file, aside, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException moveError) {
                log.error("Could not move corrupt ledger file {} aside: {}", file, moveError.getMessage());
            }
            return LedgerDocument.empty();
        }
    }

    private static void writeAtomically(Path file, LedgerDocument doc) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        LedgerJson.MAPPER.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), doc);
        try {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
