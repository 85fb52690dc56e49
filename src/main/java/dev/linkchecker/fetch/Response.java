package dev.linkchecker.fetch;

/**
 * Normalized outcome of a fetch. A status code of -1 marks the sentinel response, used whenever
 * no usable response could be obtained (denied, unreachable or retries exhausted).
 */
public record Response(String sourceUrl, int statusCode, String body) {
	public static final int NO_RESPONSE = -1;

	public Response {
		body = body == null ? "" : body;
	}

	public static Response sentinel(String url) {
		return new Response(url, NO_RESPONSE, "");
	}

	public boolean isSentinel() {
		return statusCode == NO_RESPONSE;
	}

	public boolean hasContent() {
		return !body.isEmpty();
	}

	@Override
	public String toString() {
		return "%d %s (%d chars)".formatted(statusCode, sourceUrl, body.length());
	}
}
