package insights.model.service.pipeline;

import java.time.Duration;

/** Blocking wait used for retry and recovery backoff. */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;

    Sleeper SYSTEM = d -> Thread.sleep(d.toMillis());
}
