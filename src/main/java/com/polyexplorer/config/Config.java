package com.polyexplorer.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Layered configuration: built-in defaults, then classpath {@code config.properties}, then a
 * {@code config.properties} in the working directory.
 */
public final class Config {
    private static final Logger LOG = LogManager.getLogger(Config.class);

    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir;
    }

    public static Config load(Path workingDir) {
        Config config = new Config(workingDir);

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (in != null) {
                config.props.load(in);
            }
        } catch (IOException e) {
            LOG.warn("failed to read classpath config.properties, using defaults: {}", e.getMessage());
        }

        Path local = workingDir.resolve("config.properties");
        if (Files.exists(local)) {
            try (InputStream in = Files.newInputStream(local)) {
                config.props.load(in);
            } catch (IOException e) {
                LOG.warn("failed to read {}: {}", local, e.getMessage());
            }
        }

        return config;
    }

    /**
     * Builds a config from explicit key/value overrides on top of the defaults. Null values are
     * stored as empty strings.
     */
    public static Config fromProperties(Path workingDir, Map<String, ?> overrides) {
        Config config = new Config(workingDir);
        if (overrides != null) {
            for (Map.Entry<String, ?> entry : overrides.entrySet()) {
                String key = entry.getKey() == null ? "" : entry.getKey().trim();
                if (key.isEmpty()) {
                    continue;
                }
                String value = entry.getValue() == null ? "" : String.valueOf(entry.getValue());
                config.props.setProperty(key, value);
            }
        }
        return config;
    }

    public String getString(String key) {
        String raw = props.getProperty(key);
        if (raw != null) {
            String trimmed = raw.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return DEFAULTS.getOrDefault(key, "");
    }

    public int getInt(String key) {
        return getInt(key, parseInt(DEFAULTS.get(key), 0));
    }

    public int getInt(String key, int fallback) {
        return parseInt(getString(key), fallback);
    }

    public double getDouble(String key) {
        return getDouble(key, parseDouble(DEFAULTS.get(key), 0.0));
    }

    public double getDouble(String key, double fallback) {
        return parseDouble(getString(key), fallback);
    }

    /**
     * Reads a whole number of hours. Non-positive values fall back.
     */
    public Duration getHours(String key, long fallbackHours) {
        long hours = parseInt(getString(key), (int) fallbackHours);
        return Duration.ofHours(hours > 0 ? hours : fallbackHours);
    }

    public Path getPath(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return null;
        }
        return workingDir.resolve(value).normalize();
    }

    private static int parseInt(String value, int fallback) {
        try {
            return Integer.parseInt(value.trim());
        } catch (Exception ignored) {
            return fallback;
        }
    }

    private static double parseDouble(String value, double fallback) {
        try {
            double parsed = Double.parseDouble(value.trim());
            return Double.isFinite(parsed) ? parsed : fallback;
        } catch (Exception ignored) {
            return fallback;
        }
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();

        defaults.put("polymarket.gamma_base_url", "https://gamma-api.polymarket.com");
        defaults.put("http.timeout_sec", "30");
        defaults.put("http.user_agent", "PolyExplorer/0.1");

        defaults.put("display.body_max_len", "500");
        defaults.put("display.snippet_max_len", "200");

        defaults.put("analysis.max_age_hours", "24");
        defaults.put("analysis.max_overround", "0.05");

        defaults.put("positions.path", "");
        return Map.copyOf(defaults);
    }
}
