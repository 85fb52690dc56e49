package dev.linkchecker.fetch;

import java.time.Duration;

/** Waits between retry attempts */
@FunctionalInterface
public interface Sleeper {
	Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

	void sleep(Duration duration) throws InterruptedException;
}
