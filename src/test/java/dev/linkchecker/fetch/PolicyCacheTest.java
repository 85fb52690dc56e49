package dev.linkchecker.fetch;

import static org.assertj.core.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class PolicyCacheTest {

	@Test
	void testConcurrentLookupsComputeOnce() throws Exception {
		// Given
		PolicyCache<String, Boolean> cache = new PolicyCache<>();
		AtomicInteger computations = new AtomicInteger();
		CountDownLatch start = new CountDownLatch(1);
		ExecutorService executor = Executors.newFixedThreadPool(8);

		// When
		List<Future<Boolean>> futures = new ArrayList<>();
		for (int i = 0; i < 8; i++) {
			futures.add(executor.submit(() -> {
				start.await();
				return cache.computeIfAbsent("site.org", key -> {
					computations.incrementAndGet();
					try {
						Thread.sleep(50);
					} catch (InterruptedException e) {
						Thread.currentThread().interrupt();
					}
					return true;
				});
			}));
		}
		start.countDown();
		List<Boolean> results = new ArrayList<>();
		for (Future<Boolean> future : futures) {
			results.add(future.get(5, TimeUnit.SECONDS));
		}
		executor.shutdown();

		// Then
		assertThat(computations.get()).isEqualTo(1);
		assertThat(results).hasSize(8).containsOnly(true);
	}

	@Test
	void testFailedComputationIsNotCached() {
		// Given
		PolicyCache<String, Boolean> cache = new PolicyCache<>();

		// When
		assertThatThrownBy(() -> cache.computeIfAbsent("site.org", key -> {
			throw new IllegalStateException("boom");
		})).isInstanceOf(IllegalStateException.class);

		// Then
		assertThat(cache.size()).isZero();
		assertThat(cache.computeIfAbsent("site.org", key -> false)).isFalse();
	}

	@Test
	void testPutIfAbsentKeepsFirstValue() {
		// Given
		PolicyCache<String, Boolean> cache = new PolicyCache<>();

		// When
		boolean first = cache.putIfAbsent("site.org", true);
		boolean second = cache.putIfAbsent("site.org", false);

		// Then
		assertThat(first).isTrue();
		assertThat(second).isFalse();
		assertThat(cache.getIfPresent("site.org")).contains(true);
		assertThat(cache.computeIfAbsent("site.org", key -> false)).isTrue();
	}

	@Test
	void testClear() {
		// Given
		PolicyCache<String, Integer> cache = new PolicyCache<>();
		cache.putIfAbsent("a.org", 1);
		cache.putIfAbsent("b.org", 2);

		// When
		cache.clear();

		// Then
		assertThat(cache.size()).isZero();
		assertThat(cache.getIfPresent("a.org")).isEmpty();
	}
}
