package org.springaicommunity.github.teamhealth;

import org.jspecify.annotations.Nullable;

/**
 * An evaluation could not be produced.
 *
 * <p>
 * Retryable failures (timeouts, transient provider errors, rate limits) may succeed on a
 * later run; the others (invalid replies, rejected input) will not without a change.
 */
public class EvaluationException extends RuntimeException {

	private final boolean retryable;

	private final boolean rateLimited;

	public EvaluationException(String message, boolean retryable) {
		this(message, retryable, false, null);
	}

	public EvaluationException(String message, boolean retryable, boolean rateLimited,
			@Nullable Throwable cause) {
		super(message, cause);
		this.retryable = retryable || rateLimited;
		this.rateLimited = rateLimited;
	}

	public static EvaluationException invalidResponse(ResponseValidationException cause) {
		return new EvaluationException("Invalid AI response: " + cause.getMessage(), false, false, cause);
	}

	public static EvaluationException timeout(String what) {
		return new EvaluationException(what + " timed out", true);
	}

	public static EvaluationException rateLimited(String message, Throwable cause) {
		return new EvaluationException(message, true, true, cause);
	}

	public boolean isRetryable() {
		return retryable;
	}

	public boolean isRateLimited() {
		return rateLimited;
	}

}
