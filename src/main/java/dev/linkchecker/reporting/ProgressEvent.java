package dev.linkchecker.reporting;

import java.time.Instant;

/** Represents a progress event from a pipeline stage */
public record ProgressEvent(Stage stage, EventType eventType, String message, Instant timestamp) {
	public enum Stage {
		DISCOVER,
		CHECK,
		ANALYZE
	}

	public enum EventType {
		STARTED,
		PROGRESS,
		COMPLETED,
		FAILED
	}

	public static ProgressEvent started(Stage stage, String message) {
		return new ProgressEvent(stage, EventType.STARTED, message, Instant.now());
	}

	public static ProgressEvent progress(Stage stage, String message) {
		return new ProgressEvent(stage, EventType.PROGRESS, message, Instant.now());
	}

	public static ProgressEvent completed(Stage stage, String message) {
		return new ProgressEvent(stage, EventType.COMPLETED, message, Instant.now());
	}

	public static ProgressEvent failed(Stage stage, String message) {
		return new ProgressEvent(stage, EventType.FAILED, message, Instant.now());
	}

	@Override
	public String toString() {
		return "[%s] %s: %s - %s".formatted(timestamp, stage, eventType, message);
	}
}
