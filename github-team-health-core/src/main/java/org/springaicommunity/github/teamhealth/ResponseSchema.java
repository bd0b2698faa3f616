package org.springaicommunity.github.teamhealth;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Shape of a structured AI reply: the JSON schema sent with the prompt and the parser
 * that turns the reply into a typed value.
 *
 * @param <T> the parsed type
 */
public interface ResponseSchema<T> {

	String name();

	/**
	 * JSON schema describing the reply, sent to the model with the prompt.
	 */
	JsonNode jsonSchema();

	/**
	 * Parse a reply, rejecting anything that does not match the schema.
	 * @param reply the reply as a JSON tree
	 * @return the typed value
	 * @throws ResponseValidationException if the reply does not match
	 */
	T parse(JsonNode reply) throws ResponseValidationException;

}
