package dev.astas.chapterdl.queue;

/** A queue payload that is not a valid chapter job */
public class JobDecodeException extends Exception {

	public JobDecodeException(String message) {
		super(message);
	}

	public JobDecodeException(String message, Throwable cause) {
		super(message, cause);
	}
}
