package com.alertbridge.orchestrator.workflow;

import java.time.Duration;

/**
 * The one intentional pause in a run: the wait between creation retries.
 *
 * Production uses {@link #SYSTEM}; tests swap in a recorder so they can
 * assert the backoff sequence without actually sleeping.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
