package org.springaicommunity.github.teamhealth;

import java.util.function.Function;

/**
 * Outcome of a use case: a value or a typed failure. Use cases return failures instead of
 * throwing.
 *
 * @param <T> the success value type
 */
public sealed interface OperationResult<T> permits OperationResult.Success, OperationResult.Failure {

	static <T> OperationResult<T> success(T value) {
		return new Success<>(value);
	}

	static <T> OperationResult<T> failure(FailureKind kind, String message) {
		return new Failure<>(kind, message);
	}

	boolean isSuccess();

	/**
	 * @return the success value
	 * @throws IllegalStateException if this is a failure
	 */
	T getValue();

	/**
	 * @return the failure
	 * @throws IllegalStateException if this is a success
	 */
	Failure<T> getFailure();

	/**
	 * Transform the success value, passing failures through.
	 */
	<R> OperationResult<R> map(Function<T, R> mapper);

	/**
	 * A successful outcome.
	 *
	 * @param value the produced value
	 */
	record Success<T>(T value) implements OperationResult<T> {

		@Override
		public boolean isSuccess() {
			return true;
		}

		@Override
		public T getValue() {
			return value;
		}

		@Override
		public Failure<T> getFailure() {
			throw new IllegalStateException("Operation succeeded");
		}

		@Override
		public <R> OperationResult<R> map(Function<T, R> mapper) {
			return new Success<>(mapper.apply(value));
		}

	}

	/**
	 * A failed outcome.
	 *
	 * @param kind category of the failure
	 * @param message human-readable description
	 */
	record Failure<T>(FailureKind kind, String message) implements OperationResult<T> {

		@Override
		public boolean isSuccess() {
			return false;
		}

		@Override
		public T getValue() {
			throw new IllegalStateException("Operation failed: " + message);
		}

		@Override
		public Failure<T> getFailure() {
			return this;
		}

		@Override
		public <R> OperationResult<R> map(Function<T, R> mapper) {
			return new Failure<>(kind, message);
		}

	}

	/**
	 * Failure categories surfaced by use cases.
	 */
	enum FailureKind {

		/** A referenced repository or issue does not exist. */
		NOT_FOUND,

		/** The input was rejected. */
		INVALID_INPUT,

		/** The entity already exists. */
		ALREADY_EXISTS,

		/** GitHub or the AI service failed. */
		UPSTREAM_FAILURE,

		/** Writing to the store failed. */
		PERSISTENCE_FAILURE

	}

}
