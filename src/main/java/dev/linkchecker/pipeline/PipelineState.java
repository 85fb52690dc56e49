package dev.linkchecker.pipeline;

/** Lifecycle of a pipeline run */
public enum PipelineState {
	IDLE,
	DISCOVERING,
	CHECKING,
	ANALYZING,
	DONE,
	/** Discovery could not reach the upstream source or was not authorized */
	FAILED;

	public boolean isTerminal() {
		return this == DONE || this == FAILED;
	}
}
