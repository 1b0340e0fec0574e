package dev.astas.chapterdl.admission;

import java.time.Duration;

/** Thrown when a bounded slot acquisition gives up */
public class AdmissionTimeoutException extends RuntimeException {
	private final String source;

	public AdmissionTimeoutException(String source, Duration waited) {
		super("No free slot for " + source + " within " + waited.toSeconds() + "s");
		this.source = source;
	}

	public String getSource() {
		return source;
	}
}
