package dev.linkchecker.fetch;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

/**
 * Construction settings for a {@link PoliteFetcher}.
 *
 * @param headers headers sent with every request
 * @param maxRequests maximum number of requests in flight at once
 * @param maxRetries retries after the first attempt
 * @param maxWait maximum wait for a single attempt
 * @param ignorelist domains that are never contacted
 * @param domainsOnly only evaluate domain policies, never fetch the link itself
 */
public record FetcherConfig(
		Map<String, String> headers,
		int maxRequests,
		int maxRetries,
		Duration maxWait,
		Set<String> ignorelist,
		boolean enforceIgnorelist,
		boolean enforceRobotsPolicy,
		boolean domainsOnly) {

	public static final String DEFAULT_USER_AGENT = "collection-link-checker/1.0";

	public FetcherConfig {
		headers = Map.copyOf(headers);
		ignorelist = Set.copyOf(ignorelist);
		if (maxRequests < 1) {
			throw new IllegalArgumentException("maxRequests must be positive: " + maxRequests);
		}
		if (maxRetries < 0) {
			throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
		}
	}

	/** Settings for checking links on third party sites */
	public static FetcherConfig defaults() {
		return new FetcherConfig(
				Map.of("User-Agent", DEFAULT_USER_AGENT), 5, 2, Duration.ofSeconds(60), Set.of(), true, true, false);
	}

	/** Settings for an authenticated API: generous timeouts and no crawl policies */
	public static FetcherConfig forApi(Map<String, String> headers) {
		return new FetcherConfig(headers, 10, 2, Duration.ofSeconds(300), Set.of(), false, false, false);
	}

	public FetcherConfig withMaxRequests(int maxRequests) {
		return new FetcherConfig(
				headers, maxRequests, maxRetries, maxWait, ignorelist, enforceIgnorelist, enforceRobotsPolicy, domainsOnly);
	}

	public FetcherConfig withMaxRetries(int maxRetries) {
		return new FetcherConfig(
				headers, maxRequests, maxRetries, maxWait, ignorelist, enforceIgnorelist, enforceRobotsPolicy, domainsOnly);
	}

	public FetcherConfig withIgnorelist(Set<String> ignorelist) {
		return new FetcherConfig(
				headers, maxRequests, maxRetries, maxWait, ignorelist, enforceIgnorelist, enforceRobotsPolicy, domainsOnly);
	}

	public FetcherConfig withDomainsOnly(boolean domainsOnly) {
		return new FetcherConfig(
				headers, maxRequests, maxRetries, maxWait, ignorelist, enforceIgnorelist, enforceRobotsPolicy, domainsOnly);
	}

	public FetcherConfig withRobotsPolicy(boolean enforceRobotsPolicy) {
		return new FetcherConfig(
				headers, maxRequests, maxRetries, maxWait, ignorelist, enforceIgnorelist, enforceRobotsPolicy, domainsOnly);
	}
}
