/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.nosqlbench.queuesim.config;

import io.nosqlbench.queuesim.format.DurationFormat;
import io.nosqlbench.queuesim.format.DurationFormatException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;

import java.io.BufferedReader;
import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/// Loads and validates a simulation configuration.
///
/// The file is read with snakeyaml-engine into plain maps, then environment
/// variables named `APP__<SECTION>__<KEY>` are laid over it, then the typed
/// configuration is built and checked. For example
/// `APP__RANDOM_SIMULATION__NUM_WINDOWS=4` replaces
/// `random_simulation.num_windows`. Variable names are matched case
/// insensitively and their values are read like YAML scalars.
///
/// A section which is absent is treated as disabled. A section which is
/// present runs unless `enabled` is false.
public class SimulationConfigLoader {
    private static final Logger logger = LogManager.getLogger(SimulationConfigLoader.class);

    /// The prefix of environment overrides, including the first separator
    public static final String ENV_PREFIX = "APP__";
    /// The separator between path segments of an environment override
    public static final String ENV_SEPARATOR = "__";

    public static final String FIXED_SECTION = "fixed_simulation";
    public static final String RANDOM_SECTION = "random_simulation";

    private final Map<String, String> environment;

    /// Create a loader which reads overrides from the process environment.
    public SimulationConfigLoader() {
        this(System.getenv());
    }

    /// @param environment the variables to read overrides from
    public SimulationConfigLoader(Map<String, String> environment) {
        this.environment = environment == null ? Map.of() : environment;
    }

    /// Load a configuration file.
    /// @param path the YAML file
    /// @return the validated configuration
    /// @throws ConfigException if the file is missing, unreadable or invalid
    public SimulationConfig load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ConfigException(null, "config file not found: " + path);
        }
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            Object document = newLoader().loadFromReader(reader);
            return fromDocument(document, path.toString());
        } catch (IOException e) {
            throw new ConfigException(null, "unable to read " + path + ": " + e.getMessage(), e);
        } catch (YamlEngineException e) {
            throw new ConfigException(null, "invalid YAML in " + path + ": " + e.getMessage(), e);
        }
    }

    /// Load a configuration from YAML text.
    /// @param yaml the document
    /// @param source how to name the document in messages
    /// @return the validated configuration
    public SimulationConfig loadFromString(String yaml, String source) {
        try {
            return fromDocument(newLoader().loadFromString(yaml), source);
        } catch (YamlEngineException e) {
            throw new ConfigException(null, "invalid YAML in " + source + ": " + e.getMessage(), e);
        }
    }

    private static Load newLoader() {
        LoadSettings loadSettings = LoadSettings.builder().setLabel("queuesim config").build();
        return new Load(loadSettings);
    }

    private SimulationConfig fromDocument(Object document, String source) {
        Map<String, Object> root = document == null ? new LinkedHashMap<>() : mutableCopy(asMap(document, "(root)"));
        applyEnvironment(root);

        FixedSimulationConfig fixed = readFixed(section(root, FIXED_SECTION));
        RandomSimulationConfig random = readRandom(section(root, RANDOM_SECTION));
        SimulationConfig config = new SimulationConfig(source, fixed, random);
        if (!config.anyEnabled()) {
            throw new ConfigException(null,
                "At least one simulation (" + FIXED_SECTION + " or " + RANDOM_SECTION + ") must be enabled in " + source);
        }
        logger.debug("loaded {}: fixed={}, random={}", source, fixed, random);
        return config;
    }

    private void applyEnvironment(Map<String, Object> root) {
        Map<String, String> sorted = new TreeMap<>(environment);
        for (Map.Entry<String, String> entry : sorted.entrySet()) {
            String name = entry.getKey();
            if (!name.toUpperCase(Locale.ROOT).startsWith(ENV_PREFIX)) {
                continue;
            }
            String[] segments = name.substring(ENV_PREFIX.length()).toLowerCase(Locale.ROOT).split(ENV_SEPARATOR);
            if (segments.length == 0 || List.of(segments).contains("")) {
                logger.warn("ignoring malformed override {}", name);
                continue;
            }
            Map<String, Object> target = root;
            for (int i = 0; i < segments.length - 1; i++) {
                Object child = target.get(segments[i]);
                if (!(child instanceof Map)) {
                    child = new LinkedHashMap<String, Object>();
                    target.put(segments[i], child);
                }
                target = castMap(child);
            }
            target.put(segments[segments.length - 1], entry.getValue());
            logger.debug("{} overrides {}", name, String.join(".", segments));
        }
    }

    private FixedSimulationConfig readFixed(Map<String, Object> section) {
        if (section == null || !readBoolean(section, FIXED_SECTION, "enabled", true)) {
            return FixedSimulationConfig.disabled();
        }
        int windows = readWindows(section, FIXED_SECTION);

        String customersKey = FIXED_SECTION + ".customers";
        Object listValue = section.get("customers");
        if (listValue == null) {
            throw new ConfigException(customersKey, "a list of customers is required");
        }
        if (!(listValue instanceof List)) {
            throw new ConfigException(customersKey, "expected a list, got " + describe(listValue));
        }
        List<?> entries = (List<?>) listValue;
        List<CustomerSpec> customers = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            String entryKey = customersKey + "[" + i + "]";
            Map<String, Object> entry = asMap(entries.get(i), entryKey);
            double arrival = readDuration(entry, entryKey, "arrival");
            double service = readDuration(entry, entryKey, "service");
            if (arrival < 0.0d) {
                throw new ConfigException(entryKey + ".arrival", "must not be negative, got " + arrival);
            }
            if (!(service > 0.0d)) {
                throw new ConfigException(entryKey + ".service", "must be positive, got " + service);
            }
            customers.add(new CustomerSpec(arrival, service));
        }
        customers.sort(Comparator.comparingDouble(CustomerSpec::arrival));

        return new FixedSimulationConfig(true, windows, customers, readPath(section, FIXED_SECTION, "history_file"));
    }

    private RandomSimulationConfig readRandom(Map<String, Object> section) {
        if (section == null || !readBoolean(section, RANDOM_SECTION, "enabled", true)) {
            return RandomSimulationConfig.disabled();
        }
        int windows = readWindows(section, RANDOM_SECTION);
        double avgInterval = readPositiveDuration(section, "avg_arrival_interval");
        double minService = readPositiveDuration(section, "min_service_time");
        double maxService = readPositiveDuration(section, "max_service_time");
        double maxTime = readPositiveDuration(section, "max_simulation_time");
        if (maxService < minService) {
            throw new ConfigException(RANDOM_SECTION + ".max_service_time",
                "must be >= min_service_time (" + DurationFormat.format(minService) + "), got "
                    + DurationFormat.format(maxService));
        }
        return new RandomSimulationConfig(true, windows, avgInterval, minService, maxService, maxTime,
            readPath(section, RANDOM_SECTION, "history_file"));
    }

    private int readWindows(Map<String, Object> section, String sectionName) {
        String key = sectionName + ".num_windows";
        Object value = section.get("num_windows");
        if (value == null) {
            throw new ConfigException(key, "is required");
        }
        int windows = toInt(value, key);
        if (windows < 1) {
            throw new ConfigException(key, "must be at least 1, got " + windows);
        }
        return windows;
    }

    private double readPositiveDuration(Map<String, Object> section, String name) {
        double value = readDuration(section, RANDOM_SECTION, name);
        if (!(value > 0.0d)) {
            throw new ConfigException(RANDOM_SECTION + "." + name, "must be positive, got " + value);
        }
        return value;
    }

    private static double readDuration(Map<String, Object> map, String parentKey, String name) {
        String key = parentKey + "." + name;
        Object value = map.get(name);
        if (value == null) {
            throw new ConfigException(key, "is required");
        }
        double seconds;
        if (value instanceof Number) {
            seconds = ((Number) value).doubleValue();
        } else if (value instanceof String) {
            try {
                seconds = DurationFormat.parse((String) value);
            } catch (DurationFormatException e) {
                throw new ConfigException(key, e.getMessage(), e);
            }
        } else {
            throw new ConfigException(key, "expected a duration, got " + describe(value));
        }
        if (!Double.isFinite(seconds)) {
            throw new ConfigException(key, "must be a finite duration, got " + seconds);
        }
        return seconds;
    }

    private static boolean readBoolean(Map<String, Object> map, String parentKey, String name, boolean fallback) {
        Object value = map.get(name);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            switch (((String) value).trim().toLowerCase(Locale.ROOT)) {
                case "true":
                case "yes":
                case "on":
                    return true;
                case "false":
                case "no":
                case "off":
                    return false;
                default:
                    break;
            }
        }
        throw new ConfigException(parentKey + "." + name, "expected true or false, got " + describe(value));
    }

    private static Path readPath(Map<String, Object> map, String parentKey, String name) {
        Object value = map.get(name);
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            throw new ConfigException(parentKey + "." + name, "must not be empty");
        }
        return Path.of(text);
    }

    private static int toInt(Object value, String key) {
        if (value instanceof Integer || value instanceof Long || value instanceof BigInteger) {
            BigInteger big = new BigInteger(value.toString());
            if (big.bitLength() >= Integer.SIZE) {
                throw new ConfigException(key, "is out of range: " + value);
            }
            return big.intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                throw new ConfigException(key, "expected a whole number, got '" + value + "'", e);
            }
        }
        throw new ConfigException(key, "expected a whole number, got " + describe(value));
    }

    private static Map<String, Object> section(Map<String, Object> root, String name) {
        Object value = root.get(name);
        return value == null ? null : asMap(value, name);
    }

    private static Map<String, Object> asMap(Object value, String key) {
        if (!(value instanceof Map)) {
            throw new ConfigException(key, "expected a mapping, got " + describe(value));
        }
        return castMap(value);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> castMap(Object value) {
        return (Map<String, Object>) value;
    }

    private static Map<String, Object> mutableCopy(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            Object value = entry.getValue();
            copy.put(String.valueOf(entry.getKey()), value instanceof Map ? mutableCopy((Map<?, ?>) value) : value);
        }
        return copy;
    }

    private static String describe(Object value) {
        return value == null ? "nothing" : value.getClass().getSimpleName() + " '" + value + "'";
    }
}
