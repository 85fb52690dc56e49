package dev.linkchecker.pipeline;

import dev.linkchecker.fetch.FetcherConfig;
import dev.linkchecker.util.HttpUtils;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.TreeSet;

/**
 * User-facing settings of the link checker.
 *
 * @param apiKey the WSKey of the knowledge base API
 * @param ignorelist registered domains that are never contacted
 * @param failureThreshold share of broken links (0.0 to 1.0) at which a collection is reported
 */
public record LinkCheckerSettings(String apiKey, String userAgent, List<String> ignorelist, double failureThreshold) {
	public static final double DEFAULT_FAILURE_THRESHOLD = 0.5;

	public LinkCheckerSettings {
		apiKey = apiKey == null ? "" : apiKey.strip();
		userAgent = userAgent == null || userAgent.isBlank() ? FetcherConfig.DEFAULT_USER_AGENT : userAgent.strip();
		ignorelist = normalizeIgnorelist(ignorelist == null ? List.of() : ignorelist);
		if (Double.isNaN(failureThreshold) || failureThreshold < 0.0 || failureThreshold > 1.0) {
			throw new IllegalArgumentException("Failure threshold must be between 0.0 and 1.0.");
		}
		failureThreshold = BigDecimal.valueOf(failureThreshold)
				.setScale(3, RoundingMode.HALF_EVEN)
				.doubleValue();
	}

	public static LinkCheckerSettings defaults() {
		return new LinkCheckerSettings("", null, List.of(), DEFAULT_FAILURE_THRESHOLD);
	}

	/** True if an API key is present, which is needed to run discovery */
	public boolean hasApiKey() {
		return !apiKey.isEmpty();
	}

	private static List<String> normalizeIgnorelist(List<String> entries) {
		TreeSet<String> domains = new TreeSet<>();
		for (String entry : entries) {
			if (entry == null || entry.isBlank()) {
				continue;
			}
			String domain = HttpUtils.normalizeDomain(entry);
			if (domain.isEmpty()) {
				throw new IllegalArgumentException("Invalid domain in ignorelist: " + entry.strip());
			}
			domains.add(domain);
		}
		return List.copyOf(domains);
	}
}
