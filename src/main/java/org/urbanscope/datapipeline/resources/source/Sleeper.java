package org.urbanscope.datapipeline.resources.source;

import java.time.Duration;

/**
 * Blocking wait, replaceable in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
