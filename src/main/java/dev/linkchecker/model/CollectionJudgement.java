package dev.linkchecker.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** Availability verdict for one collection, derived from its checked resources */
public record CollectionJudgement(
		String collectionId, int brokenCount, int totalCount, double brokenRatio, double threshold) {

	public static CollectionJudgement of(String collectionId, int brokenCount, int totalCount, double threshold) {
		return new CollectionJudgement(collectionId, brokenCount, totalCount, ratio(brokenCount, totalCount), threshold);
	}

	/** Broken share rounded to two decimals; 0.0 for an empty collection */
	static double ratio(int brokenCount, int totalCount) {
		if (totalCount <= 0) {
			return 0.0;
		}
		return BigDecimal.valueOf(brokenCount)
				.divide(BigDecimal.valueOf(totalCount), 2, RoundingMode.HALF_EVEN)
				.doubleValue();
	}

	public boolean isBroken() {
		return brokenRatio >= threshold;
	}

	/** Broken ratio as a percentage, e.g. {@code 50.0} */
	public double brokenPercent() {
		return BigDecimal.valueOf(brokenRatio).movePointRight(2).doubleValue();
	}

	@Override
	public String toString() {
		return "%s%% (%d / %d) of links in collection %s could not be accessed."
				.formatted(brokenPercent(), brokenCount, totalCount, collectionId);
	}
}
