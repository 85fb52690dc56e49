package dev.linkchecker.source;

/** Thrown when the upstream source returns a payload in an unexpected format */
public class UpstreamFormatException extends Exception {
	public UpstreamFormatException(String message) {
		super(message);
	}

	public UpstreamFormatException(String message, Throwable cause) {
		super(message, cause);
	}
}
