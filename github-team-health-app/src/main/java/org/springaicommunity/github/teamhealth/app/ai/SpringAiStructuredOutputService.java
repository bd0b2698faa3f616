package org.springaicommunity.github.teamhealth.app.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.github.teamhealth.EvaluationException;
import org.springaicommunity.github.teamhealth.ResponseValidationException;
import org.springaicommunity.github.teamhealth.StructuredOutputParser;
import org.springaicommunity.github.teamhealth.StructuredOutputRequest;
import org.springaicommunity.github.teamhealth.StructuredOutputService;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.web.client.ResourceAccessException;

import java.util.List;
import java.util.Locale;

/**
 * {@link StructuredOutputService} on top of a Spring AI {@link ChatModel}.
 *
 * <p>
 * The reply schema goes into the system message, the rubric prompt into the user message.
 * Provider failures are mapped onto {@link EvaluationException}: transient errors and
 * timeouts are retryable, HTTP 429 is reported as rate limited, and anything else
 * (including a reply that does not match the schema) is permanent.
 */
public class SpringAiStructuredOutputService implements StructuredOutputService {

	private static final Logger logger = LoggerFactory.getLogger(SpringAiStructuredOutputService.class);

	private final ChatModel chatModel;

	private final StructuredOutputParser parser;

	private final ObjectMapper objectMapper;

	public SpringAiStructuredOutputService(ChatModel chatModel, StructuredOutputParser parser,
			ObjectMapper objectMapper) {
		this.chatModel = chatModel;
		this.parser = parser;
		this.objectMapper = objectMapper;
	}

	@Override
	public <T> T generateStructuredOutput(StructuredOutputRequest<T> request) {
		Prompt prompt = new Prompt(
				List.of(new SystemMessage(systemText(request)), new UserMessage(request.prompt())),
				ChatOptions.builder().temperature(request.temperature()).maxTokens(request.maxTokens()).build());

		String reply = call(prompt, request.schema().name());
		try {
			return parser.parse(reply, request.schema());
		}
		catch (ResponseValidationException e) {
			logger.warn("Rejected {} reply: {}", request.schema().name(), e.getMessage());
			throw EvaluationException.invalidResponse(e);
		}
	}

	private String call(Prompt prompt, String schemaName) {
		ChatResponse response;
		try {
			response = chatModel.call(prompt);
		}
		catch (TransientAiException e) {
			throw new EvaluationException("AI request failed: " + e.getMessage(), true, false, e);
		}
		catch (NonTransientAiException e) {
			if (isRateLimit(e)) {
				throw EvaluationException.rateLimited("AI rate limit exceeded: " + e.getMessage(), e);
			}
			throw new EvaluationException("AI request rejected: " + e.getMessage(), false, false, e);
		}
		catch (ResourceAccessException e) {
			throw new EvaluationException("AI request timed out or could not connect: " + e.getMessage(), true,
					false, e);
		}

		if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
			throw EvaluationException.invalidResponse(new ResponseValidationException("Empty reply"));
		}
		String text = response.getResult().getOutput().getText();
		if (text == null || text.isBlank()) {
			throw EvaluationException.invalidResponse(new ResponseValidationException("Empty reply"));
		}
		logger.debug("Received {} characters for {}", text.length(), schemaName);
		return text;
	}

	private String systemText(StructuredOutputRequest<?> request) {
		String schema;
		try {
			schema = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(request.schema().jsonSchema());
		}
		catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to render schema " + request.schema().name(), e);
		}
		return """
				You are a strict reviewer. Reply with exactly one JSON object and nothing else.
				The object must match this JSON schema:
				%s
				""".formatted(schema);
	}

	static boolean isRateLimit(RuntimeException e) {
		String message = e.getMessage();
		if (message == null) {
			return false;
		}
		String lower = message.toLowerCase(Locale.ROOT);
		return lower.startsWith("429") || lower.contains(" 429 ") || lower.contains("rate limit")
				|| lower.contains("too many requests");
	}

}
