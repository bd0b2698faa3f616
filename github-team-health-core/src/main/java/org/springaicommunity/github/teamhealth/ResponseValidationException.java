package org.springaicommunity.github.teamhealth;

/**
 * Thrown when an AI reply is not valid JSON or does not match the expected schema.
 */
public class ResponseValidationException extends Exception {

	public ResponseValidationException(String message) {
		super(message);
	}

	public ResponseValidationException(String message, Throwable cause) {
		super(message, cause);
	}

}
