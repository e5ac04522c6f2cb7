package in.ledgerguard.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StrategyConfigLoaderTest {

    @TempDir
    Path tempDir;

    private final StrategyConfigLoader loader = new StrategyConfigLoader();

    @Test
    void testMissingFileFallsBackToBundledStrategies() {
        List<StrategyConfig> strategies = loader.load(tempDir.resolve("absent.json"));

        assertEquals(2, strategies.size());
        StrategyConfig btc = strategies.stream().filter(s -> s.name().equals("btc-trend")).findFirst().orElseThrow();
        assertEquals("BTCUSDT", btc.symbol());
        assertEquals(5, btc.leverage());
        assertEquals(Duration.ofMinutes(5), btc.cooldown());
        assertTrue(btc.validate().isEmpty());
    }

    @Test
    void testFileOverridesBundledStrategies() throws IOException {
        Path file = tempDir.resolve("strategies.json");
        Files.writeString(file, """
            {
              "strategies": [
                { "name": "sol-breakout", "symbol": "SOLUSDT", "margin": 25, "leverage": 2,
                  "cooldown": "PT1M", "comment": "ignored" }
              ]
            }
            """);

        List<StrategyConfig> strategies = loader.load(file);

        assertEquals(1, strategies.size());
        StrategyConfig sol = strategies.get(0);
        assertEquals(0, new BigDecimal("25").compareTo(sol.margin()));
        assertEquals(Duration.ofMinutes(1), sol.cooldown());
        assertEquals(StrategyConfig.DEFAULT_ASSESSMENT_INTERVAL, sol.assessmentInterval(), "Defaults fill gaps");
        assertEquals(0, StrategyConfig.DEFAULT_MAX_LOSS_PCT.compareTo(sol.maxLossPct()));
    }

    @Test
    void testMalformedFileFails() throws IOException {
        Path file = tempDir.resolve("strategies.json");
        Files.writeString(file, "{ \"strategies\": [ ");

        assertThrows(IllegalStateException.class, () -> loader.load(file));
    }

    @Test
    void testMissingResourceFails() {
        assertThrows(IllegalStateException.class, () -> loader.loadResource("no-such-strategies.json"));
    }

    @Test
    void testValidationListsEveryProblem() {
        StrategyConfig broken = new StrategyConfig("bad", " ", BigDecimal.ZERO, -2,
            null, Duration.ofMinutes(-1), Duration.ZERO, null);

        List<String> errors = broken.validate();

        assertEquals(5, errors.size(), errors.toString());
        assertTrue(errors.contains("bad: symbol is required"));
    }

    @Test
    void testCatalogRejectsDuplicateNamesAndDefaultsCooldown() {
        StrategyConfig a = new StrategyConfig("a", "BTCUSDT", BigDecimal.TEN, 2, null, null, null, null);
        assertThrows(IllegalArgumentException.class,
            () -> new StrategyCatalog(List.of(a, a), Duration.ofMinutes(7)));

        StrategyCatalog catalog = new StrategyCatalog(List.of(a), Duration.ofMinutes(7));
        assertEquals(Duration.ofMinutes(7), catalog.cooldownFor(StrategyCatalog.UNATTRIBUTED));
        assertEquals(1, catalog.leverageFor("unknown"));
        assertEquals(List.of(a), catalog.forSymbol("BTCUSDT"));
    }
}
