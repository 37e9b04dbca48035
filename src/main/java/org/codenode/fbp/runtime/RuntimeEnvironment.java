package org.codenode.fbp.runtime;

import java.util.Objects;

/**
 * The collaborators every runtime of one flow shares.
 *
 * @param settings   Runtime tunables.
 * @param registry   Registry the runtimes join while running, or {@code null} for unmanaged runtimes.
 * @param timeSource Clock for generators and speed attenuation.
 */
public record RuntimeEnvironment(RuntimeSettings settings, RuntimeRegistry registry, TimeSource timeSource) {

    public RuntimeEnvironment {
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(timeSource, "timeSource");
    }
}
