package dev.linkchecker.reporting;

/** Receives the progress notifications of a pipeline run */
@FunctionalInterface
public interface ProgressListener {
	ProgressListener NONE = event -> {};

	void report(ProgressEvent event);
}
