package dev.linkchecker.fetch;

import dev.linkchecker.util.HttpUtils;
import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client that respects the crawl policies of the sites it visits.
 *
 * <p>Before a link is requested its redirect target is resolved, the target domain is checked
 * against the ignorelist and its robots.txt is consulted (fetched once per domain and shared by
 * concurrent callers). Requests are admitted through a semaphore sized to the configured number of
 * concurrent requests and retried with backoff until an accepted status code arrives.
 *
 * <p>None of the request methods throw: any failure yields {@link Response#sentinel(String)}.
 */
public class PoliteFetcher implements Closeable {
	private static final Logger logger = LoggerFactory.getLogger(PoliteFetcher.class);

	/** Status codes that end the retry loop */
	public static final Set<Integer> ACCEPTED_CODES = Set.of(200, 202, 400, 401, 403, 404, 410, 429, 451, 503);

	static final String GET = "GET";
	static final String HEAD = "HEAD";
	private static final String USER_AGENT = "User-Agent";

	private final HttpTransport transport;
	private final Backoff backoff;
	private final Sleeper sleeper;
	private final Semaphore admission;
	private final int maxRetries;
	private final boolean enforceIgnorelist;
	private final boolean enforceRobotsPolicy;
	private final Map<String, String> headers;
	private volatile Set<String> ignorelist;
	private volatile boolean domainsOnly;

	private final PolicyCache<String, Boolean> redirectPolicies = new PolicyCache<>();
	private final PolicyCache<String, Boolean> robotsPolicies = new PolicyCache<>();

	public PoliteFetcher(FetcherConfig config) {
		this(config, new ApacheHttpTransport(config.maxRequests(), config.maxWait()), new Backoff(), Sleeper.THREAD);
	}

	public PoliteFetcher(FetcherConfig config, HttpTransport transport, Backoff backoff, Sleeper sleeper) {
		this.transport = transport;
		this.backoff = backoff;
		this.sleeper = sleeper;
		this.admission = new Semaphore(config.maxRequests(), true);
		this.maxRetries = config.maxRetries();
		this.enforceIgnorelist = config.enforceIgnorelist();
		this.enforceRobotsPolicy = config.enforceRobotsPolicy();
		this.headers = new ConcurrentHashMap<>(config.headers());
		this.ignorelist = normalize(config.ignorelist());
		this.domainsOnly = config.domainsOnly();
	}

	/** Fetch a URL with GET */
	public Response get(String url) {
		return get(url, Map.of());
	}

	/** Fetch a URL with GET, adding the given query parameters */
	public Response get(String url, Map<String, String> params) {
		return request(GET, url, params);
	}

	/** Probe a URL with HEAD */
	public Response head(String url) {
		return request(HEAD, url, Map.of());
	}

	private Response request(String method, String url, Map<String, String> params) {
		Optional<String> target = resolveAccess(url);
		if (target.isEmpty()) {
			return Response.sentinel(url);
		}
		if (domainsOnly) {
			return new Response(url, 200, "");
		}
		return send(method, url, params, true);
	}

	/**
	 * Resolve the effective target of a URL and apply the ignorelist and robots policy to it.
	 *
	 * @return the effective target, or empty if the URL must not be fetched
	 */
	private Optional<String> resolveAccess(String url) {
		if (!enforceIgnorelist && !enforceRobotsPolicy) {
			return Optional.of(url);
		}
		if (isIgnored(url)) {
			return Optional.empty();
		}
		String target = resolveRedirect(url);
		if (!target.equals(url) && isIgnored(target)) {
			return Optional.empty();
		}
		if (enforceRobotsPolicy && !isAllowedByRobots(target)) {
			logger.warn("Skipped URL \"{}\" - robots.txt of \"{}\" does not allow access", url, HttpUtils.getDomain(target));
			return Optional.empty();
		}
		return Optional.of(target);
	}

	private boolean isIgnored(String url) {
		if (!enforceIgnorelist) {
			return false;
		}
		String domain = HttpUtils.getDomain(url);
		if (ignorelist.contains(domain)) {
			logger.warn("Skipped URL \"{}\" - Domain \"{}\" is in the ignorelist", url, domain);
			return true;
		}
		return false;
	}

	/**
	 * Follow the redirects of a URL with a single HEAD probe. Domains that were seen not to
	 * redirect are not probed again.
	 */
	private String resolveRedirect(String url) {
		String domain = HttpUtils.getDomain(url);
		Optional<Boolean> redirects = redirectPolicies.getIfPresent(domain);
		if (redirects.isPresent() && !redirects.get()) {
			return url;
		}
		Response probe = send(HEAD, url, Map.of(), false);
		String target = probe.isSentinel() ? url : probe.sourceUrl();
		boolean redirected = !target.equals(url);
		if (redirectPolicies.putIfAbsent(domain, redirected)) {
			logger.debug("Domain \"{}\" {}", domain, redirected ? "redirects to " + target : "does not redirect");
		}
		return target;
	}

	private boolean isAllowedByRobots(String target) {
		String domain = HttpUtils.getDomain(target);
		if (domain.isEmpty()) {
			return true;
		}
		return robotsPolicies.computeIfAbsent(domain, key -> {
			Response robots = send(GET, RobotsPolicy.robotsUrl(key), Map.of(), false);
			boolean allowed = new RobotsPolicy(HttpUtils.productToken(headers.get(USER_AGENT)))
					.isAllowed(robots, target);
			logger.debug("robots.txt of \"{}\" ({}) {} access", key, robots.statusCode(), allowed ? "allows" : "denies");
			return allowed;
		});
	}

	/**
	 * Send a request, retrying until the response is usable or the retries are used up.
	 *
	 * @param allowRetries false to return whatever the first attempt produced
	 */
	private Response send(String method, String url, Map<String, String> params, boolean allowRetries) {
		URI uri;
		try {
			uri = HttpUtils.buildUri(url, params);
		} catch (URISyntaxException e) {
			logger.warn("Failed to send HTTP {} request to \"{}\" - Not a valid link", method, url);
			return Response.sentinel(url);
		}

		int attempts = allowRetries ? maxRetries + 1 : 1;
		for (int attempt = 1; attempt <= attempts; attempt++) {
			boolean finalAttempt = attempt == attempts;
			TransportResponse response;
			try {
				response = exchange(method, uri);
			} catch (IOException e) {
				logger.debug("HTTP {} request to \"{}\" failed: {}", method, url, e.toString());
				response = null;
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				logger.warn("Interrupted while requesting \"{}\"", url);
				return Response.sentinel(url);
			} catch (RuntimeException e) {
				logger.warn("Failed to send HTTP {} request to \"{}\" - {}", method, url, e.toString());
				return Response.sentinel(url);
			}

			if (!allowRetries) {
				return response != null ? toResponse(method, url, uri, response) : Response.sentinel(url);
			}
			if (response != null && isUsable(method, response, finalAttempt)) {
				return toResponse(method, url, uri, response);
			}
			if (!finalAttempt) {
				Duration wait = backoff.delay(attempt, response != null ? response.retryAfter() : null);
				logger.debug(
						"Retrying HTTP {} request to \"{}\" in {} ms (status {})",
						method,
						url,
						wait.toMillis(),
						response != null ? response.statusCode() : Response.NO_RESPONSE);
				try {
					sleeper.sleep(wait);
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
					logger.warn("Interrupted while waiting to retry \"{}\"", url);
					return Response.sentinel(url);
				}
			}
		}
		logger.warn("Failed to fetch \"{}\" - No valid response after {} attempts", url, attempts);
		return Response.sentinel(url);
	}

	private TransportResponse exchange(String method, URI uri) throws IOException, InterruptedException {
		admission.acquire();
		try {
			logger.debug("Sending HTTP {} request to \"{}\"", method, uri);
			return transport.send(method, uri, Map.copyOf(headers));
		} finally {
			admission.release();
		}
	}

	/** Accepted status code, and content unless it is a HEAD request or the last try */
	private static boolean isUsable(String method, TransportResponse response, boolean finalAttempt) {
		if (!ACCEPTED_CODES.contains(response.statusCode())) {
			return false;
		}
		return HEAD.equals(method) || finalAttempt || !response.body().isEmpty();
	}

	/** A response served from the request URI itself is reported under the caller's URL */
	private static Response toResponse(String method, String url, URI uri, TransportResponse response) {
		String source = uri.toString().equals(response.url()) ? url : response.url();
		return new Response(source, response.statusCode(), HEAD.equals(method) ? "" : response.body());
	}

	/** Replace the User-Agent sent with every request */
	public void updateUserAgent(String userAgent) {
		setHeader(USER_AGENT, userAgent);
	}

	/** Set a header sent with every request */
	public void setHeader(String name, String value) {
		String previous = headers.put(name, value);
		if (!value.equals(previous)) {
			logger.debug("Header \"{}\" changed", name);
		}
	}

	public String getHeader(String name) {
		return headers.get(name);
	}

	public void updateIgnorelist(Collection<String> domains) {
		this.ignorelist = normalize(domains);
		logger.debug("Ignorelist changed to {}", ignorelist);
	}

	public Set<String> getIgnorelist() {
		return ignorelist;
	}

	/** Only evaluate domain policies, answering 200 or -1 without requesting the link itself */
	public void setDomainsOnly(boolean domainsOnly) {
		this.domainsOnly = domainsOnly;
	}

	public boolean isDomainsOnly() {
		return domainsOnly;
	}

	/** Forget all redirect and robots decisions */
	public void clearPolicies() {
		redirectPolicies.clear();
		robotsPolicies.clear();
	}

	/** Number of domains with a cached robots decision */
	int robotsPolicyCount() {
		return robotsPolicies.size();
	}

	private static Set<String> normalize(Collection<String> domains) {
		return domains.stream()
				.map(HttpUtils::normalizeDomain)
				.filter(domain -> !domain.isEmpty())
				.collect(Collectors.toUnmodifiableSet());
	}

	/** Close the pooled connections; the next request reopens them */
	@Override
	public void close() {
		transport.close();
	}
}
