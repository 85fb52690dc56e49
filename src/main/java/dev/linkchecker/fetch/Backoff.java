package dev.linkchecker.fetch;

import dev.linkchecker.util.HttpUtils;
import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/** Computes the wait before a retry attempt */
public class Backoff {
	static final Duration MAX_BACKOFF = Duration.ofSeconds(60);

	private final Clock clock;
	private final DoubleSupplier jitter;

	public Backoff() {
		this(Clock.systemUTC(), () -> ThreadLocalRandom.current().nextDouble());
	}

	/**
	 * @param jitter supplies random fractions of a second in [0, 1)
	 */
	public Backoff(Clock clock, DoubleSupplier jitter) {
		this.clock = clock;
		this.jitter = jitter;
	}

	/**
	 * Get the wait before the given retry.
	 *
	 * <p>A Retry-After header wins when it parses: an HTTP date waits until that instant, a number
	 * waits that many seconds plus jitter. Otherwise the wait is {@code 2^attempt} seconds plus
	 * jitter, capped at {@link #MAX_BACKOFF}.
	 *
	 * @param attempt the retry number, starting at 1
	 * @param retryAfter the Retry-After header of the previous response, or null
	 */
	public Duration delay(int attempt, String retryAfter) {
		if (retryAfter != null && !retryAfter.isBlank()) {
			String value = retryAfter.trim();
			ZonedDateTime date = HttpUtils.parseHttpDate(value);
			if (date != null) {
				Duration until = Duration.between(clock.instant(), date.toInstant());
				return until.isNegative() ? Duration.ZERO : until;
			}
			if (value.length() < 10 && value.chars().allMatch(Character::isDigit)) {
				return Duration.ofSeconds(Long.parseLong(value)).plus(jitterMillis());
			}
		}
		double seconds = Math.pow(2, Math.min(attempt, 30)) + jitter.getAsDouble();
		Duration wait = Duration.ofMillis((long) (seconds * 1000));
		return wait.compareTo(MAX_BACKOFF) > 0 ? MAX_BACKOFF : wait;
	}

	private Duration jitterMillis() {
		return Duration.ofMillis((long) (jitter.getAsDouble() * 1000));
	}
}
