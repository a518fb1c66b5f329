package dev.invox.invoiceparser.usage;

import java.time.Duration;

/**
 * Suspends the calling thread. Replaced in tests so that minute windows can be advanced without waiting.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
