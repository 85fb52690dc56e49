package dev.linkchecker.fetch;

import static org.assertj.core.api.Assertions.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class BackoffTest {

	private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

	private final Backoff backoff = new Backoff(Clock.fixed(NOW, ZoneOffset.UTC), () -> 0.5);

	@Test
	void testExponentialDelay() {
		assertThat(backoff.delay(1, null)).isEqualTo(Duration.ofMillis(2500));
		assertThat(backoff.delay(2, null)).isEqualTo(Duration.ofMillis(4500));
		assertThat(backoff.delay(3, "")).isEqualTo(Duration.ofMillis(8500));
	}

	@Test
	void testDelayIsCapped() {
		assertThat(backoff.delay(6, null)).isEqualTo(Backoff.MAX_BACKOFF);
		assertThat(backoff.delay(1000, null)).isEqualTo(Backoff.MAX_BACKOFF);
	}

	@Test
	void testRetryAfterSeconds() {
		assertThat(backoff.delay(1, "2")).isEqualTo(Duration.ofMillis(2500));
		assertThat(backoff.delay(4, " 120 ")).isEqualTo(Duration.ofMillis(120500));
	}

	@Test
	void testRetryAfterDate() {
		assertThat(backoff.delay(1, "Fri, 1 Mar 2024 12:00:30 GMT")).isEqualTo(Duration.ofSeconds(30));
	}

	@Test
	void testRetryAfterDateInThePast() {
		assertThat(backoff.delay(1, "Fri, 1 Mar 2024 11:00:00 GMT")).isEqualTo(Duration.ZERO);
	}

	@Test
	void testUnparseableRetryAfterFallsBackToExponential() {
		assertThat(backoff.delay(2, "soon")).isEqualTo(Duration.ofMillis(4500));
		assertThat(backoff.delay(2, "99999999999999")).isEqualTo(Duration.ofMillis(4500));
	}

	@Test
	void testDefaultJitterStaysBelowOneSecond() {
		Backoff random = new Backoff();
		for (int i = 0; i < 20; i++) {
			assertThat(random.delay(1, null)).isBetween(Duration.ofSeconds(2), Duration.ofMillis(2999));
		}
	}
}
