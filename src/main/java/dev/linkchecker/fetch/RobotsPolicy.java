package dev.linkchecker.fetch;

import crawlercommons.robots.BaseRobotRules;
import crawlercommons.robots.SimpleRobotRulesParser;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Turns a fetched robots.txt into an allow/deny decision for a URL */
public class RobotsPolicy {
	private static final Logger logger = LoggerFactory.getLogger(RobotsPolicy.class);

	private final String robotName;

	/**
	 * @param robotName the product token matched against robots.txt user-agent lines
	 */
	public RobotsPolicy(String robotName) {
		this.robotName = robotName;
	}

	public static String robotsUrl(String domain) {
		return "https://" + domain + "/robots.txt";
	}

	/**
	 * Decide whether a URL may be fetched.
	 *
	 * <p>A 200 response is parsed and evaluated for the URL. A client error (4xx) denies. Any other
	 * outcome, including no response at all or an unparseable file, allows.
	 */
	public boolean isAllowed(Response robots, String url) {
		int code = robots.statusCode();
		if (code >= 400 && code < 500) {
			logger.debug("robots.txt at {} returned {}, denying {}", robots.sourceUrl(), code, url);
			return false;
		}
		if (code != 200) {
			return true;
		}
		try {
			SimpleRobotRulesParser parser = new SimpleRobotRulesParser();
			BaseRobotRules rules = parser.parseContent(
					robots.sourceUrl(), robots.body().getBytes(StandardCharsets.UTF_8), "text/plain", robotName);
			return rules.isAllowed(url);
		} catch (RuntimeException e) {
			logger.warn("Failed to parse robots.txt at {}, allowing {}", robots.sourceUrl(), url, e);
			return true;
		}
	}
}
