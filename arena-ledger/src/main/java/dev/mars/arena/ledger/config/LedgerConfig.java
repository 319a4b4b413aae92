/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.arena.ledger.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Centralized configuration for the vote ledger.
 *
 * <p>Loads configuration from {@code badge-arena.properties} on the classpath with system property
 * and environment variable override support. Environment variables take precedence and use
 * uppercase with underscores (e.g., arena.data.dir -> ARENA_DATA_DIR).</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-03
 */
public final class LedgerConfig {

    private static final Logger logger = LoggerFactory.getLogger(LedgerConfig.class);
    private static final String CONFIG_FILE = "badge-arena.properties";

    public static final String DEFAULT_CONTEST_ID = "badge-arena";

    private static LedgerConfig instance;

    private final Properties properties;

    private LedgerConfig(Properties properties) {
        this.properties = properties;
    }

    /**
     * Gets the process-wide configuration, loading it from the classpath on first use.
     */
    public static synchronized LedgerConfig get() {
        if (instance == null) {
            instance = new LedgerConfig(loadProperties());
            instance.logConfiguration();
        }
        return instance;
    }

    /**
     * Creates a configuration backed by explicit properties. Environment and system
     * property overrides still apply.
     */
    public static LedgerConfig fromProperties(Properties properties) {
        Properties copy = new Properties();
        copy.putAll(properties);
        return new LedgerConfig(copy);
    }

    // ==================== Storage Configuration ====================

    /**
     * Directory holding votes.json, vote-events.ndjson, logos.json, contests.json and backups/.
     */
    public Path getDataDir() {
        return Path.of(getString("arena.data.dir", "server/runtime-data"));
    }

    public boolean isFsyncEnabled() {
        return getBoolean("arena.storage.fsync", true);
    }

    // ==================== Backup Configuration ====================

    public long getBackupMinIntervalMs() {
        return getLong("arena.backup.min-interval-ms", 60_000L);
    }

    /**
     * Number of backups kept per prefix; zero or negative keeps every backup.
     */
    public int getBackupMaxRetained() {
        return getInt("arena.backup.max-retained", 120);
    }

    // ==================== Contest Configuration ====================

    public String getDefaultContestId() {
        return getString("arena.contest.default-id", DEFAULT_CONTEST_ID);
    }

    public int getLeaderboardSize() {
        return getInt("arena.leaderboard.size", 5);
    }

    // ==================== Generic Accessors ====================

    public String getString(String key, String defaultValue) {
        // 1. Check environment variable (ARENA_DATA_DIR format)
        String envKey = key.toUpperCase().replace('.', '_').replace('-', '_');
        String envValue = System.getenv(envKey);
        if (envValue != null && !envValue.isEmpty()) {
            return envValue;
        }

        // 2. Check system property (-Darena.data.dir format)
        String sysValue = System.getProperty(key);
        if (sysValue != null && !sysValue.isEmpty()) {
            return sysValue;
        }

        // 3. Check properties file
        return properties.getProperty(key, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for {}: '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid long value for {}: '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    // ==================== Private Helpers ====================

    private static Properties loadProperties() {
        Properties properties = new Properties();
        try (InputStream input = LedgerConfig.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from {}", CONFIG_FILE);
            } else {
                logger.warn("Configuration file {} not found, using defaults", CONFIG_FILE);
            }
        } catch (IOException e) {
            logger.error("Error loading configuration file: {}", e.getMessage());
            logger.trace("Stack trace for configuration load error", e);
        }
        return properties;
    }

    void logConfiguration() {
        logger.info("=== Badge Arena Ledger Configuration ===");
        logger.info("  Data Dir:             {}", getDataDir().toAbsolutePath());
        logger.info("  Fsync:                {}", isFsyncEnabled());
        logger.info("  --- Backups ---");
        logger.info("  Min Interval:         {}ms", getBackupMinIntervalMs());
        logger.info("  Max Retained:         {}", getBackupMaxRetained());
        logger.info("  --- Contests ---");
        logger.info("  Default Contest:      {}", getDefaultContestId());
        logger.info("  Leaderboard Size:     {}", getLeaderboardSize());
        logger.info("=========================================");
    }
}
