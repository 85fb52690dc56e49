package dev.linkchecker.pipeline;

import dev.linkchecker.model.CollectionJudgement;
import java.util.List;

/** Per-collection judgements of an analysis, in collection id order */
public record AnalysisReport(List<CollectionJudgement> judgements) {

	public AnalysisReport {
		judgements = List.copyOf(judgements);
	}

	public static AnalysisReport empty() {
		return new AnalysisReport(List.of());
	}

	public List<CollectionJudgement> brokenCollections() {
		return judgements.stream().filter(CollectionJudgement::isBroken).toList();
	}

	public int brokenCount() {
		return brokenCollections().size();
	}

	@Override
	public String toString() {
		return "%d collection(s) analyzed, %d exceeded the failure threshold".formatted(judgements.size(), brokenCount());
	}
}
