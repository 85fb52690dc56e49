package dev.linkchecker.fetch;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

class RobotsPolicyTest {

	private static final String ROBOTS_URL = "https://site.org/robots.txt";

	private final RobotsPolicy policy = new RobotsPolicy("collection-link-checker");

	@Test
	void testRobotsUrl() {
		assertThat(RobotsPolicy.robotsUrl("site.org")).isEqualTo(ROBOTS_URL);
	}

	@Test
	void testParsedRulesDecide() {
		// Given
		Response robots = new Response(ROBOTS_URL, 200, "User-agent: *\nDisallow: /private/\n");

		// When / Then
		assertThat(policy.isAllowed(robots, "https://site.org/public/page")).isTrue();
		assertThat(policy.isAllowed(robots, "https://site.org/private/page")).isFalse();
	}

	@Test
	void testRulesForOwnAgent() {
		// Given
		Response robots = new Response(
				ROBOTS_URL,
				200,
				"User-agent: collection-link-checker\nDisallow: /\n\nUser-agent: *\nAllow: /\n");

		// When / Then
		assertThat(policy.isAllowed(robots, "https://site.org/page")).isFalse();
		assertThat(new RobotsPolicy("otherbot").isAllowed(robots, "https://site.org/page")).isTrue();
	}

	@Test
	void testClientErrorDenies() {
		assertThat(policy.isAllowed(new Response(ROBOTS_URL, 404, ""), "https://site.org/page")).isFalse();
		assertThat(policy.isAllowed(new Response(ROBOTS_URL, 401, ""), "https://site.org/page")).isFalse();
	}

	@Test
	void testOtherOutcomesAllow() {
		assertThat(policy.isAllowed(Response.sentinel(ROBOTS_URL), "https://site.org/page")).isTrue();
		assertThat(policy.isAllowed(new Response(ROBOTS_URL, 503, ""), "https://site.org/page")).isTrue();
		assertThat(policy.isAllowed(new Response(ROBOTS_URL, 200, ""), "https://site.org/page")).isTrue();
	}
}
