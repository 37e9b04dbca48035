package org.codenode.fbp.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Execution control settings shared by code and graph nodes.
 *
 * @param independentControl when {@code true} the node ignores state changes propagated from an ancestor or
 *                           issued as a bulk registry operation; it only reacts to direct calls.
 * @param pauseBufferSize    number of packets a paused node may hold back. Must be positive.
 * @param speedAttenuation   delay inserted after every processing cycle. Must not be negative.
 */
public record ControlConfig(boolean independentControl, int pauseBufferSize, Duration speedAttenuation) {

    public static final int DEFAULT_PAUSE_BUFFER_SIZE = 100;

    public ControlConfig {
        Objects.requireNonNull(speedAttenuation, "speedAttenuation");
        if (pauseBufferSize <= 0) {
            throw new IllegalArgumentException("Pause buffer size must be positive, got " + pauseBufferSize);
        }
        if (speedAttenuation.isNegative()) {
            throw new IllegalArgumentException("Speed attenuation cannot be negative, got " + speedAttenuation);
        }
    }

    public static ControlConfig defaults() {
        return new ControlConfig(false, DEFAULT_PAUSE_BUFFER_SIZE, Duration.ZERO);
    }

    public static ControlConfig independent() {
        return defaults().withIndependentControl(true);
    }

    public ControlConfig withIndependentControl(boolean independent) {
        return new ControlConfig(independent, pauseBufferSize, speedAttenuation);
    }

    public ControlConfig withPauseBufferSize(int size) {
        return new ControlConfig(independentControl, size, speedAttenuation);
    }

    public ControlConfig withSpeedAttenuation(Duration attenuation) {
        return new ControlConfig(independentControl, pauseBufferSize, attenuation);
    }
}
