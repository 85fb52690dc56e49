package dev.linkchecker.util;

import crawlercommons.domains.EffectiveTldFinder;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import org.apache.hc.core5.net.URIBuilder;

/** Utility class for URL, domain and header handling */
public class HttpUtils {

	private static final int MAX_PORT = 65535;
	private static final String ALLOWED =
			"ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789-._~:/?@!$&'()*+,;=";
	private static final char[] HEX = "0123456789ABCDEF".toCharArray();

	private HttpUtils() {}

	/**
	 * Get the registered domain of a URL, e.g. {@code example.org} for
	 * {@code https://www.example.org/path}.
	 *
	 * @return the lower-cased domain, or an empty string when the URL has no host
	 */
	public static String getDomain(String url) {
		if (url == null || url.isBlank()) {
			return "";
		}
		String host;
		try {
			host = toUri(url.trim()).getHost();
		} catch (URISyntaxException e) {
			return "";
		}
		return host == null ? "" : registeredDomain(host);
	}

	/**
	 * Normalize an ignorelist entry, which may be a bare host name or a full URL, to its
	 * registered domain.
	 *
	 * @return the domain, or an empty string when the entry does not name a host
	 */
	public static String normalizeDomain(String entry) {
		if (entry == null || entry.isBlank()) {
			return "";
		}
		String value = entry.trim();
		if (!value.contains("://")) {
			value = "https://" + value;
		}
		String domain = getDomain(value);
		return domain.contains(".") ? domain : "";
	}

	private static String registeredDomain(String host) {
		String normalized = host.toLowerCase(Locale.ROOT);
		if (normalized.endsWith(".")) {
			normalized = normalized.substring(0, normalized.length() - 1);
		}
		String domain = EffectiveTldFinder.getAssignedDomain(normalized);
		return domain == null || domain.isBlank() ? normalized : domain;
	}

	/**
	 * Build the request URI for a URL and its query parameters. Characters that may not appear in
	 * a URI, such as spaces, are percent-encoded.
	 */
	public static URI buildUri(String url, Map<String, String> params) throws URISyntaxException {
		if (url == null || url.isBlank()) {
			throw new URISyntaxException(String.valueOf(url), "Empty URL");
		}
		URI uri = toUri(url.trim());
		if (uri.getScheme() == null || uri.getHost() == null) {
			throw new URISyntaxException(url, "URL is not absolute");
		}
		if (uri.getPort() > MAX_PORT) {
			throw new URISyntaxException(url, "Port out of range");
		}
		if (params.isEmpty()) {
			return uri;
		}
		URIBuilder builder = new URIBuilder(uri);
		params.forEach(builder::addParameter);
		return builder.build();
	}

	private static URI toUri(String url) throws URISyntaxException {
		try {
			return new URI(url);
		} catch (URISyntaxException e) {
			return new URI(encodeIllegalCharacters(url));
		}
	}

	/** Percent-encode (as UTF-8) every character that RFC 3986 does not allow in a URI */
	static String encodeIllegalCharacters(String url) {
		StringBuilder encoded = new StringBuilder(url.length() + 16);
		boolean inFragment = false;
		for (int i = 0; i < url.length(); i++) {
			char c = url.charAt(i);
			if (c == '%' && i + 2 < url.length() && isHex(url.charAt(i + 1)) && isHex(url.charAt(i + 2))) {
				encoded.append(c);
			} else if (c == '#' && !inFragment) {
				inFragment = true;
				encoded.append(c);
			} else if (ALLOWED.indexOf(c) >= 0) {
				encoded.append(c);
			} else {
				int end = Character.isHighSurrogate(c) && i + 1 < url.length() ? i + 2 : i + 1;
				for (byte b : url.substring(i, end).getBytes(StandardCharsets.UTF_8)) {
					encoded.append('%').append(HEX[(b >> 4) & 0xF]).append(HEX[b & 0xF]);
				}
				i = end - 1;
			}
		}
		return encoded.toString();
	}

	private static boolean isHex(char c) {
		return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
	}

	/**
	 * Parse an HTTP date such as {@code Wed, 21 Oct 2015 07:28:00 GMT}.
	 *
	 * @return the parsed date or null if the value is not an HTTP date
	 */
	public static ZonedDateTime parseHttpDate(String value) {
		if (value == null || value.isBlank()) {
			return null;
		}
		try {
			return ZonedDateTime.parse(value.trim(), DateTimeFormatter.RFC_1123_DATE_TIME);
		} catch (DateTimeParseException e) {
			return null;
		}
	}

	/** Get the robots.txt product token of a User-Agent, e.g. {@code mybot} for {@code MyBot/1.2 (+info)} */
	public static String productToken(String userAgent) {
		if (userAgent == null || userAgent.isBlank()) {
			return "*";
		}
		String token = userAgent.trim().split("[/\\s]", 2)[0];
		return token.isEmpty() ? "*" : token.toLowerCase(Locale.ROOT);
	}
}
