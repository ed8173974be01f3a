package com.phillippitts.engramdesk.service.sidecar;

import java.time.Duration;

/**
 * Suspension seam for grace periods, backoff and cooldowns, so tests can observe the
 * requested delays without waiting for them.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
