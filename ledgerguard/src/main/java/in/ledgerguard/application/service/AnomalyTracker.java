package in.ledgerguard.application.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers which anomalies were already reported so each occurrence is reported once.
 *
 * KEYS:
 * - orphan:&lt;tradeId&gt;
 * - ghost:&lt;symbol&gt;:&lt;side&gt;
 * - drift:&lt;symbol&gt;:&lt;side&gt;
 *
 * A key is forgotten (and reported as cleared) once its condition is no longer observed.
 */
public final class AnomalyTracker {
    private static final Logger log = LoggerFactory.getLogger(AnomalyTracker.class);

    public static final String ORPHAN_PREFIX = "orphan:";
    public static final String GHOST_PREFIX = "ghost:";
    public static final String DRIFT_PREFIX = "drift:";

    private final Set<String> reported = ConcurrentHashMap.newKeySet();

    public static String orphanKey(String tradeId) {
        return ORPHAN_PREFIX + tradeId;
    }

    public static String ghostKey(String positionKey) {
        return GHOST_PREFIX + positionKey;
    }

    public static String driftKey(String positionKey) {
        return DRIFT_PREFIX + positionKey;
    }

    /**
     * Mark {@code key} as reported.
     *
     * @return true the first time the key is seen, false while it stays reported
     */
    public boolean report(String key) {
        boolean first = reported.add(key);
        if (!first) {
            log.debug("Anomaly {} already reported", key);
        }
        return first;
    }

    public boolean isReported(String key) {
        return reported.contains(key);
    }

    /**
     * Forget reported keys under {@code prefix} that were not observed this cycle.
     *
     * @param prefix   Key family checked this cycle
     * @param observed Keys whose condition is still present
     * @return keys that cleared
     */
    public List<String> clearAbsent(String prefix, Collection<String> observed) {
        List<String> cleared = new ArrayList<>();
        for (String key : List.copyOf(reported)) {
            if (key.startsWith(prefix) && !observed.contains(key) && reported.remove(key)) {
                cleared.add(key);
            }
        }
        return cleared;
    }

    public int size() {
        return reported.size();
    }
}
