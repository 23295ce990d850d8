package com.oddsfeed.infrastructure.scraper;

import java.time.Duration;

/**
 * Pause between retry attempts. Implementations must honour thread interruption.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
