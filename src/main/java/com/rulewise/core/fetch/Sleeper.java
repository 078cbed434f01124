package com.rulewise.core.fetch;

import java.time.Duration;

/**
 * Blocks the calling thread between retries. Tests substitute a recording
 * implementation so backoff schedules run instantly.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
