package org.springaicommunity.github.teamhealth;

import org.jspecify.annotations.Nullable;

/**
 * A prompt whose reply must match a schema.
 *
 * @param schema expected reply shape
 * @param prompt the prompt text
 * @param temperature sampling temperature, or null for the model default
 * @param maxTokens reply token limit, or null for the model default
 * @param <T> the parsed reply type
 */
public record StructuredOutputRequest<T>(ResponseSchema<T> schema, String prompt, @Nullable Double temperature,
		@Nullable Integer maxTokens) {

	public static <T> StructuredOutputRequest<T> of(ResponseSchema<T> schema, String prompt,
			TeamHealthProperties properties) {
		return new StructuredOutputRequest<>(schema, prompt, properties.getTemperature(), properties.getMaxTokens());
	}

}
