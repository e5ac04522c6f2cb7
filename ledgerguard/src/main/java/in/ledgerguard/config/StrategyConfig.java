package in.ledgerguard.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-strategy settings loaded from {@code strategies.json}.
 *
 * @param name               Unique strategy name, the position slot key
 * @param symbol             Symbol the strategy trades
 * @param margin             Target margin per position
 * @param leverage           Leverage applied to the margin
 * @param maxLossPct         Loss, in percent of margin used, that triggers the failsafe close
 * @param cooldown           Time after a close during which no new position may open
 * @param assessmentInterval Tick interval of the assessment loop
 * @param quantityStep       Exchange quantity increment; sizes are rounded down to it
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StrategyConfig(
        @JsonProperty("name") String name,
        @JsonProperty("symbol") String symbol,
        @JsonProperty("margin") BigDecimal margin,
        @JsonProperty("leverage") int leverage,
        @JsonProperty("max_loss_pct") BigDecimal maxLossPct,
        @JsonProperty("cooldown") Duration cooldown,
        @JsonProperty("assessment_interval") Duration assessmentInterval,
        @JsonProperty("quantity_step") BigDecimal quantityStep) {

    public static final Duration DEFAULT_COOLDOWN = Duration.ofMinutes(5);
    public static final Duration DEFAULT_ASSESSMENT_INTERVAL = Duration.ofSeconds(30);
    public static final BigDecimal DEFAULT_MAX_LOSS_PCT = new BigDecimal("10");
    public static final BigDecimal DEFAULT_QUANTITY_STEP = new BigDecimal("0.001");

    public StrategyConfig {
        if (leverage == 0) leverage = 1;
        if (maxLossPct == null) maxLossPct = DEFAULT_MAX_LOSS_PCT;
        if (cooldown == null) cooldown = DEFAULT_COOLDOWN;
        if (assessmentInterval == null) assessmentInterval = DEFAULT_ASSESSMENT_INTERVAL;
        if (quantityStep == null) quantityStep = DEFAULT_QUANTITY_STEP;
    }

    /**
     * Check the fields a position cannot be sized or guarded without.
     *
     * @return list of problems, empty when valid
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        String label = name == null ? "<unnamed>" : name;
        if (name == null || name.isBlank()) errors.add("strategy name is required");
        if (symbol == null || symbol.isBlank()) errors.add(label + ": symbol is required");
        if (margin == null || margin.signum() <= 0) errors.add(label + ": margin must be positive");
        if (leverage < 1) errors.add(label + ": leverage must be >= 1");
        if (maxLossPct.signum() <= 0) errors.add(label + ": max_loss_pct must be positive");
        if (cooldown.isNegative()) errors.add(label + ": cooldown must not be negative");
        if (assessmentInterval.isNegative() || assessmentInterval.isZero()) {
            errors.add(label + ": assessment_interval must be positive");
        }
        if (quantityStep.signum() <= 0) errors.add(label + ": quantity_step must be positive");
        return errors;
    }
}
