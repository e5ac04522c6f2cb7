package in.ledgerguard.config;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable view of the configured strategies, keyed by name.
 */
public final class StrategyCatalog {
    /** Strategy name used for ghost positions no configured strategy claims. */
    public static final String UNATTRIBUTED = "unattributed";

    private final Map<String, StrategyConfig> byName;
    private final Duration defaultCooldown;

    public StrategyCatalog(List<StrategyConfig> strategies, Duration defaultCooldown) {
        Map<String, StrategyConfig> map = new LinkedHashMap<>();
        for (StrategyConfig config : strategies) {
            if (map.putIfAbsent(config.name(), config) != null) {
                throw new IllegalArgumentException("Duplicate strategy name: " + config.name());
            }
        }
        this.byName = Map.copyOf(map);
        this.defaultCooldown = defaultCooldown;
    }

    public Optional<StrategyConfig> find(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public Collection<StrategyConfig> all() {
        return byName.values();
    }

    public List<StrategyConfig> forSymbol(String symbol) {
        return byName.values().stream()
            .filter(c -> c.symbol().equals(symbol))
            .toList();
    }

    /**
     * Cooldown of a strategy; unknown strategies (such as {@link #UNATTRIBUTED}) use the default.
     */
    public Duration cooldownFor(String name) {
        StrategyConfig config = byName.get(name);
        return config != null ? config.cooldown() : defaultCooldown;
    }

    /**
     * Leverage of a strategy; unknown strategies are treated as unleveraged.
     */
    public int leverageFor(String name) {
        StrategyConfig config = byName.get(name);
        return config != null ? config.leverage() : 1;
    }

    public int size() {
        return byName.size();
    }
}
