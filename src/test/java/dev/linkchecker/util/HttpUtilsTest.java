package dev.linkchecker.util;

import static org.assertj.core.api.Assertions.*;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Map;
import org.junit.jupiter.api.Test;

class HttpUtilsTest {

	@Test
	void testGetDomain() {
		assertThat(HttpUtils.getDomain("https://www.Site.org/path?q=1")).isEqualTo("site.org");
		assertThat(HttpUtils.getDomain("http://journals.publisher.co.uk/a")).isEqualTo("publisher.co.uk");
		assertThat(HttpUtils.getDomain("https://site.org")).isEqualTo("site.org");
	}

	@Test
	void testGetDomainWithoutHost() {
		assertThat(HttpUtils.getDomain("")).isEmpty();
		assertThat(HttpUtils.getDomain(null)).isEmpty();
		assertThat(HttpUtils.getDomain("not a url")).isEmpty();
		assertThat(HttpUtils.getDomain("/relative/path")).isEmpty();
	}

	@Test
	void testNormalizeDomain() {
		assertThat(HttpUtils.normalizeDomain("www.site.org")).isEqualTo("site.org");
		assertThat(HttpUtils.normalizeDomain(" https://cdn.site.org/x ")).isEqualTo("site.org");
		assertThat(HttpUtils.normalizeDomain("localhost")).isEmpty();
		assertThat(HttpUtils.normalizeDomain("")).isEmpty();
	}

	@Test
	void testBuildUri() throws URISyntaxException {
		assertThat(HttpUtils.buildUri("https://site.org/a%20b", Map.of())).isEqualTo(new URI("https://site.org/a%20b"));

		URI uri = HttpUtils.buildUri("https://api.site.org/search?q=x", Map.of("startIndex", "51"));
		assertThat(uri.getHost()).isEqualTo("api.site.org");
		assertThat(uri.getQuery()).isEqualTo("q=x&startIndex=51");
	}

	@Test
	void testBuildUriRejectsInvalidLinks() {
		assertThatThrownBy(() -> HttpUtils.buildUri("", Map.of())).isInstanceOf(URISyntaxException.class);
		assertThatThrownBy(() -> HttpUtils.buildUri("site.org/page", Map.of())).isInstanceOf(URISyntaxException.class);
		assertThatThrownBy(() -> HttpUtils.buildUri("not a url", Map.of())).isInstanceOf(URISyntaxException.class);
		assertThatThrownBy(() -> HttpUtils.buildUri("http://example.com:99999/x", Map.of()))
				.isInstanceOf(URISyntaxException.class)
				.hasMessageContaining("Port out of range");
	}

	@Test
	void testBuildUriEncodesIllegalCharacters() throws URISyntaxException {
		assertThat(HttpUtils.buildUri("https://site.org/a b", Map.of()).getRawPath()).isEqualTo("/a%20b");
		assertThat(HttpUtils.buildUri(" https://site.org/search?q=a|b ", Map.of()).getRawQuery()).isEqualTo("q=a%7Cb");

		URI uri = HttpUtils.buildUri("https://site.org/Journal of Things", Map.of("startIndex", "1"));
		assertThat(uri.getPath()).isEqualTo("/Journal of Things");
		assertThat(uri.getQuery()).isEqualTo("startIndex=1");
	}

	@Test
	void testEncodeIllegalCharacters() {
		assertThat(HttpUtils.encodeIllegalCharacters("https://site.org/a%20b c")).isEqualTo("https://site.org/a%20b%20c");
		assertThat(HttpUtils.encodeIllegalCharacters("https://site.org/100%zz")).isEqualTo("https://site.org/100%25zz");
		assertThat(HttpUtils.encodeIllegalCharacters("https://site.org/caf\u00e9")).isEqualTo("https://site.org/caf%C3%A9");
		assertThat(HttpUtils.encodeIllegalCharacters("https://site.org/a#b#c")).isEqualTo("https://site.org/a#b%23c");
		assertThat(HttpUtils.encodeIllegalCharacters("https://site.org/\"x\"")).isEqualTo("https://site.org/%22x%22");
	}

	@Test
	void testGetDomainOfLinkWithIllegalCharacters() {
		assertThat(HttpUtils.getDomain("https://www.site.org/a b")).isEqualTo("site.org");
	}

	@Test
	void testParseHttpDate() {
		assertThat(HttpUtils.parseHttpDate("Wed, 21 Oct 2015 07:28:00 GMT").withZoneSameInstant(ZoneOffset.UTC))
				.isEqualTo(ZonedDateTime.of(2015, 10, 21, 7, 28, 0, 0, ZoneOffset.UTC));
		assertThat(HttpUtils.parseHttpDate("120")).isNull();
		assertThat(HttpUtils.parseHttpDate(null)).isNull();
	}

	@Test
	void testProductToken() {
		assertThat(HttpUtils.productToken("MyBot/1.2 (+https://site.org/bot)")).isEqualTo("mybot");
		assertThat(HttpUtils.productToken("collection-link-checker/1.0")).isEqualTo("collection-link-checker");
		assertThat(HttpUtils.productToken(null)).isEqualTo("*");
		assertThat(HttpUtils.productToken("  ")).isEqualTo("*");
	}
}
