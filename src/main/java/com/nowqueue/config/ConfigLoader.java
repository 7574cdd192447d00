package com.nowqueue.config;

import com.nowqueue.exception.ConfigurationException;
import com.nowqueue.strategy.StrategyType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads engine configuration from YAML files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static EngineConfig load(String path) {
        log.info("Loading engine configuration from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parse(inputStream);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Resolve a path, honoring the classpath: prefix.
     */
    public static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    /**
     * Parse configuration from a YAML stream.
     */
    @SuppressWarnings("unchecked")
    public static EngineConfig parse(InputStream inputStream) {
        Map<String, Object> root;
        try {
            root = new Yaml().load(inputStream);
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed configuration YAML: " + e.getMessage(), e);
        }

        if (root == null) {
            throw new ConfigurationException("Configuration file is empty");
        }

        try {
            // The engine section may be at root or under 'nowqueue'
            Map<String, Object> engineConfig = root.containsKey("nowqueue")
                    ? (Map<String, Object>) root.get("nowqueue")
                    : root;

            String name = getString(engineConfig, "name", "default-engine");
            String version = getString(engineConfig, "version", "1.0");

            ScoringConfig scoring = parseScoring((Map<String, Object>) engineConfig.get("scoring"));
            WeightTable weightTable = parseWeightTable((Map<String, Object>) engineConfig.get("weight-table"));
            SelectionConfig selection = parseSelection((Map<String, Object>) engineConfig.get("selection"));
            PhaseConfig phase = parsePhase((Map<String, Object>) engineConfig.get("phase"));

            if (phase.isFixed() && !weightTable.hasPhase(phase.current())) {
                log.warn("Fixed phase '{}' has no weight-table row, category weights will be 0", phase.current());
            }

            EngineConfig config = new EngineConfig(name, version, scoring, weightTable, selection, phase);

            log.info("Loaded engine configuration: {} v{} with {} phases, strategy: {}, timeout: {}ms, phase: {}",
                    name, version, weightTable.phases().size(), selection.effectiveStrategy(),
                    selection.solverTimeoutMs(),
                    phase.isFixed() ? phase.current() : "calendar from " + phase.semesterStart());

            return config;
        } catch (ClassCastException | IllegalArgumentException e) {
            throw new ConfigurationException("Invalid configuration structure: " + e.getMessage(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private static ScoringConfig parseScoring(Map<String, Object> map) {
        if (map == null) {
            log.warn("No scoring section configured, using defaults");
            return ScoringConfig.defaults();
        }
        ScoringConfig defaults = ScoringConfig.defaults();

        UrgencyDecayConfig urgency = UrgencyDecayConfig.defaults();
        Map<String, Object> urgencyMap = (Map<String, Object>) map.get("urgency");
        if (urgencyMap != null) {
            urgency = new UrgencyDecayConfig(
                    getDouble(urgencyMap, "weight", urgency.weight()),
                    getDouble(urgencyMap, "max-value", urgency.maxValue()),
                    getDouble(urgencyMap, "half-life-days", urgency.halfLifeDays())
            );
        }

        ImpactConfig impact = ImpactConfig.defaults();
        Map<String, Object> impactMap = (Map<String, Object>) map.get("impact");
        if (impactMap != null) {
            impact = new ImpactConfig(
                    getDouble(impactMap, "weight", impact.weight()),
                    getDouble(impactMap, "max-value", impact.maxValue()),
                    getDouble(impactMap, "half-saturation", impact.halfSaturation())
            );
        }

        return new ScoringConfig(
                urgency,
                impact,
                getDouble(map, "category-weight", defaults.categoryWeight()),
                getDouble(map, "anchor-bonus", defaults.anchorBonus()),
                getDouble(map, "chain-head-bonus", defaults.chainHeadBonus())
        );
    }

    @SuppressWarnings("unchecked")
    private static WeightTable parseWeightTable(Map<String, Object> map) {
        if (map == null) {
            log.warn("No weight-table configured, category weights will be 0");
            return WeightTable.empty();
        }
        Map<String, Map<String, Double>> rows = new LinkedHashMap<>();
        for (Map.Entry<String, Object> phaseEntry : map.entrySet()) {
            Map<String, Object> categories = (Map<String, Object>) phaseEntry.getValue();
            Map<String, Double> row = new LinkedHashMap<>();
            if (categories != null) {
                for (String category : categories.keySet()) {
                    row.put(category, getDouble(categories, category, 0.0));
                }
            }
            rows.put(phaseEntry.getKey(), row);
            log.debug("Parsed weight-table row: phase={}, categories={}", phaseEntry.getKey(), row.size());
        }
        return new WeightTable(rows);
    }

    private static SelectionConfig parseSelection(Map<String, Object> map) {
        if (map == null) {
            return SelectionConfig.defaults();
        }
        SelectionConfig defaults = SelectionConfig.defaults();

        String typeStr = getString(map, "strategy", defaults.strategy().name());
        StrategyType strategy;
        try {
            strategy = StrategyType.valueOf(typeStr.toUpperCase().replace("-", "_"));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown selection strategy: " + typeStr, e);
        }

        Integer wipCap = map.containsKey("wip-cap")
                ? (map.get("wip-cap") == null ? null : getInt(map, "wip-cap", 0))
                : defaults.wipCap();

        return new SelectionConfig(
                strategy,
                getBoolean(map, "exact-solver-enabled", defaults.exactSolverEnabled()),
                getLong(map, "solver-timeout-ms", defaults.solverTimeoutMs()),
                getInt(map, "default-k", defaults.defaultK()),
                getInt(map, "default-timebox-minutes", defaults.defaultTimeboxMinutes()),
                getInt(map, "min-courses", defaults.minCourses()),
                getInt(map, "min-size", defaults.minSize()),
                getInt(map, "heavy-threshold-minutes", defaults.heavyThresholdMinutes()),
                getInt(map, "max-heavy", defaults.maxHeavy()),
                wipCap
        );
    }

    private static PhaseConfig parsePhase(Map<String, Object> map) {
        if (map == null) {
            log.warn("No phase configured, defaulting to '{}'", PhaseConfig.IN_TERM);
            return PhaseConfig.fixed(PhaseConfig.IN_TERM);
        }
        return new PhaseConfig(
                getString(map, "current", null),
                getDate(map, "semester-start"),
                getWindow(map, "pre-launch"),
                getWindow(map, "launch-week"),
                getWindow(map, "week-one")
        );
    }

    // Helper methods

    private static PhaseConfig.Window getWindow(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) return null;
        if (!(value instanceof List<?> bounds) || bounds.size() != 2) {
            throw new ConfigurationException("Phase window '" + key + "' must be a list of two day offsets");
        }
        return new PhaseConfig.Window(
                Integer.parseInt(bounds.get(0).toString()),
                Integer.parseInt(bounds.get(1).toString()));
    }

    private static LocalDate getDate(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) return null;
        // SnakeYAML resolves unquoted ISO dates to java.util.Date
        if (value instanceof Date date) {
            return date.toInstant().atZone(ZoneOffset.UTC).toLocalDate();
        }
        try {
            return LocalDate.parse(value.toString());
        } catch (DateTimeParseException e) {
            throw new ConfigurationException("Invalid date for '" + key + "': " + value, e);
        }
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        return Integer.parseInt(value.toString());
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString());
    }

    private static long getLong(Map<String, Object> map, String key, long defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).longValue();
        return Long.parseLong(value.toString());
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).doubleValue();
        return Double.parseDouble(value.toString());
    }
}
