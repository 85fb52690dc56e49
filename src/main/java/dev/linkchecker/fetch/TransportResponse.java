package dev.linkchecker.fetch;

/**
 * Raw response handed back by a {@link HttpTransport}.
 *
 * @param url the URL the response was finally served from, after any redirects
 * @param retryAfter value of the Retry-After header, or null
 */
public record TransportResponse(String url, int statusCode, String body, String retryAfter) {

	public TransportResponse {
		body = body == null ? "" : body;
	}

	public static TransportResponse of(String url, int statusCode, String body) {
		return new TransportResponse(url, statusCode, body, null);
	}
}
