package org.springaicommunity.github.stalerepos;

/**
 * Thrown when a GitHub response does not have the shape the parser requires, for example
 * a release whose author account no longer resolves.
 */
public class UnexpectedPayloadException extends RuntimeException {

	public UnexpectedPayloadException(String message) {
		super(message);
	}

	public UnexpectedPayloadException(String message, Throwable cause) {
		super(message, cause);
	}

}
