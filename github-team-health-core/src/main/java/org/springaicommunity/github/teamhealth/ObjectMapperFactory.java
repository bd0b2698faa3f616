package org.springaicommunity.github.teamhealth;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Factory for a consistently configured {@link ObjectMapper}.
 *
 * <p>
 * Stored evaluation details are written with {@link PropertyNamingStrategies#SNAKE_CASE}
 * keys and ISO-8601 dates (e.g.&nbsp;{@code evaluatedAt} &rarr; {@code evaluated_at}).
 */
public final class ObjectMapperFactory {

	private ObjectMapperFactory() {
	}

	public static ObjectMapper create() {
		ObjectMapper mapper = new ObjectMapper();
		mapper.registerModule(new JavaTimeModule());
		mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
		mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
		mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
		return mapper;
	}

}
