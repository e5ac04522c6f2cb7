package in.ledgerguard.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads strategy settings from a JSON document:
 * <pre>
 * { "strategies": [ { "name": "...", "symbol": "...", "margin": 100, ... } ] }
 * </pre>
 */
public final class StrategyConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(StrategyConfigLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public static final String DEFAULT_RESOURCE = "strategies.json";

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StrategyFile(@JsonProperty("strategies") List<StrategyConfig> strategies) {}

    /**
     * Load from {@code path} when it exists, otherwise from the classpath resource.
     *
     * @throws IllegalStateException if neither can be read
     */
    public List<StrategyConfig> load(Path path) {
        if (path != null && Files.exists(path)) {
            try (InputStream in = Files.newInputStream(path)) {
                List<StrategyConfig> strategies = parse(in);
                log.info("Loaded {} strategies from {}", strategies.size(), path);
                return strategies;
            } catch (IOException e) {
                throw new IllegalStateException("Cannot read strategy file " + path + ": " + e.getMessage(), e);
            }
        }
        return loadResource(DEFAULT_RESOURCE);
    }

    public List<StrategyConfig> loadResource(String resource) {
        try (InputStream in = StrategyConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Strategy resource not found on classpath: " + resource);
            }
            List<StrategyConfig> strategies = parse(in);
            log.info("Loaded {} strategies from classpath:{}", strategies.size(), resource);
            return strategies;
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read strategy resource " + resource + ": " + e.getMessage(), e);
        }
    }

    List<StrategyConfig> parse(InputStream in) throws IOException {
        StrategyFile file = MAPPER.readValue(in, StrategyFile.class);
        return file.strategies() == null ? List.of() : List.copyOf(file.strategies());
    }
}
