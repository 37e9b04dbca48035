package org.codenode.fbp.junit.extensions.logging;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Each test logs something the default rules would reject and passes only because of its annotation.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class LogWatchExtensionTest {

    private static final Logger log = LoggerFactory.getLogger(LogWatchExtensionTest.class);

    @Test
    @AllowLog(level = LogLevel.WARN, messagePattern = "channel .* is full")
    void allowedWarningPasses() {
        log.warn("channel {} is full", "sensor.out");
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "node failed: .*", occurrences = 2)
    void expectedErrorsAreCounted() {
        log.error("node failed: {}", "first");
        log.error("node failed: {}", "second");
    }

    @Test
    @FailOnLog(level = LogLevel.ERROR)
    void raisedThresholdToleratesWarnings() {
        log.warn("slow consumer detected");
    }

    @Test
    @FailOnLog(disabled = true)
    void disabledCheckToleratesErrors() {
        log.error("ignored failure");
    }
}
