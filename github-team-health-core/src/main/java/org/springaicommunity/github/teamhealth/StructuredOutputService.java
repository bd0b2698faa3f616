package org.springaicommunity.github.teamhealth;

/**
 * Sends a prompt to an AI model and returns the reply parsed against a schema.
 */
public interface StructuredOutputService {

	/**
	 * @param request the prompt and its expected reply shape
	 * @return the validated reply
	 * @throws EvaluationException if the model cannot be reached or its reply is invalid
	 */
	<T> T generateStructuredOutput(StructuredOutputRequest<T> request);

}
