package dev.linkchecker.model;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

class CollectionJudgementTest {

	@Test
	void testRatioIsRounded() {
		assertThat(CollectionJudgement.ratio(1, 3)).isEqualTo(0.33);
		assertThat(CollectionJudgement.ratio(2, 3)).isEqualTo(0.67);
		assertThat(CollectionJudgement.ratio(1, 8)).isEqualTo(0.12);
		assertThat(CollectionJudgement.ratio(0, 0)).isEqualTo(0.0);
	}

	@Test
	void testBrokenAtThreshold() {
		assertThat(CollectionJudgement.of("C1", 1, 2, 0.5).isBroken()).isTrue();
		assertThat(CollectionJudgement.of("C1", 1, 2, 0.6).isBroken()).isFalse();
		assertThat(CollectionJudgement.of("C1", 0, 4, 0.0).isBroken()).isTrue();
	}

	@Test
	void testMessage() {
		CollectionJudgement judgement = CollectionJudgement.of("C1", 2, 3, 0.5);

		assertThat(judgement.brokenPercent()).isEqualTo(67.0);
		assertThat(judgement.toString()).isEqualTo("67.0% (2 / 3) of links in collection C1 could not be accessed.");
	}
}
