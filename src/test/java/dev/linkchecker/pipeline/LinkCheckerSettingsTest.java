package dev.linkchecker.pipeline;

import static org.assertj.core.api.Assertions.*;

import dev.linkchecker.fetch.FetcherConfig;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class LinkCheckerSettingsTest {

	@Test
	void testDefaults() {
		LinkCheckerSettings settings = LinkCheckerSettings.defaults();

		assertThat(settings.apiKey()).isEmpty();
		assertThat(settings.hasApiKey()).isFalse();
		assertThat(settings.userAgent()).isEqualTo(FetcherConfig.DEFAULT_USER_AGENT);
		assertThat(settings.ignorelist()).isEmpty();
		assertThat(settings.failureThreshold()).isEqualTo(0.5);
	}

	@Test
	void testThresholdOutOfRange() {
		assertThatThrownBy(() -> new LinkCheckerSettings("key", null, List.of(), 1.5))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("Failure threshold must be between 0.0 and 1.0.");
		assertThatThrownBy(() -> new LinkCheckerSettings("key", null, List.of(), -0.1))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> new LinkCheckerSettings("key", null, List.of(), Double.NaN))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void testThresholdBounds() {
		assertThat(new LinkCheckerSettings("key", null, List.of(), 0.0).failureThreshold()).isEqualTo(0.0);
		assertThat(new LinkCheckerSettings("key", null, List.of(), 1.0).failureThreshold()).isEqualTo(1.0);
		assertThat(new LinkCheckerSettings("key", null, List.of(), 0.33333).failureThreshold()).isEqualTo(0.333);
	}

	@Test
	void testIgnorelistIsNormalized() {
		// Given
		List<String> entries = Arrays.asList(
				"https://www.Publisher-Site.org/path", "publisher-site.org", "journals.other-site.co.uk", " ", null);

		// When
		LinkCheckerSettings settings = new LinkCheckerSettings(" key ", " bot/1.0 ", entries, 0.5);

		// Then
		assertThat(settings.ignorelist()).containsExactly("other-site.co.uk", "publisher-site.org");
		assertThat(settings.apiKey()).isEqualTo("key");
		assertThat(settings.userAgent()).isEqualTo("bot/1.0");
	}

	@Test
	void testInvalidIgnorelistEntry() {
		assertThatThrownBy(() -> new LinkCheckerSettings("key", null, List.of("localhost"), 0.5))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("Invalid domain in ignorelist: localhost");
	}
}
