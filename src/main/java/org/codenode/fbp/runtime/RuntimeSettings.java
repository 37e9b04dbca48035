package org.codenode.fbp.runtime;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

import java.time.Duration;
import java.util.Map;

/**
 * Tunables shared by all runtimes created by one {@link RuntimeFactory}.
 *
 * @param defaultChannelCapacity Capacity of output channels that were not given an explicit one.
 *                               {@code 0} is a rendezvous channel, {@code -1} unbounded.
 * @param pausePollInterval      Upper bound on how long a paused runtime or a blocked input receive
 *                               takes to notice a state change.
 */
public record RuntimeSettings(int defaultChannelCapacity, Duration pausePollInterval) {

    public static final String CONFIG_PATH = "fbp.runtime";

    public RuntimeSettings {
        if (defaultChannelCapacity < -1) {
            throw new IllegalArgumentException("defaultChannelCapacity must be -1, 0 or positive, got " + defaultChannelCapacity);
        }
        if (pausePollInterval == null || pausePollInterval.isNegative() || pausePollInterval.isZero()) {
            throw new IllegalArgumentException("pausePollInterval must be positive, got " + pausePollInterval);
        }
    }

    public static RuntimeSettings defaults() {
        return new RuntimeSettings(64, Duration.ofMillis(10));
    }

    /**
     * Reads the {@code fbp.runtime} section of the given configuration. Missing keys fall back to
     * {@link #defaults()}.
     *
     * @param config The application configuration (usually from {@code ConfigLoader}).
     * @throws IllegalArgumentException if a value is missing its expected type or out of range.
     */
    public static RuntimeSettings fromConfig(Config config) {
        Config section = config.hasPath(CONFIG_PATH) ? config.getConfig(CONFIG_PATH) : ConfigFactory.empty();
        Config defaults = ConfigFactory.parseMap(Map.of(
            "defaultChannelCapacity", 64,
            "pausePollInterval", "10ms"
        ));
        try {
            Config merged = section.withFallback(defaults);
            return new RuntimeSettings(
                merged.getInt("defaultChannelCapacity"),
                merged.getDuration("pausePollInterval"));
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid runtime configuration at '" + CONFIG_PATH + "'", e);
        }
    }

    public RuntimeSettings withDefaultChannelCapacity(int capacity) {
        return new RuntimeSettings(capacity, pausePollInterval);
    }

    public RuntimeSettings withPausePollInterval(Duration interval) {
        return new RuntimeSettings(defaultChannelCapacity, interval);
    }

    long pausePollMillis() {
        return Math.max(1L, pausePollInterval.toMillis());
    }
}
