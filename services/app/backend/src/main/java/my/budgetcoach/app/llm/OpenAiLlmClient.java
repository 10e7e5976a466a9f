package my.budgetcoach.app.llm;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Chat-completions client for OpenAI compatible endpoints.
 */
public class OpenAiLlmClient implements LlmClient {
	private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
	private static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(30);
	private static final String BUDGET_SYSTEM_PROMPT = "You are a personal budgeting coach. Explain the computed figures "
			+ "in plain text, in at most five short sentences. Never change or recompute the numbers you are given.";
	private static final String GOAL_SYSTEM_PROMPT = "You are a personal savings coach. Explain the computed goal plan "
			+ "in plain text, in at most four short sentences. Never change or recompute the numbers you are given.";

	private final RestClient restClient;
	private final String model;

	public OpenAiLlmClient(String baseUrl, String apiKey, String model) {
		this(baseUrl, apiKey, model, DEFAULT_CONNECT_TIMEOUT, DEFAULT_READ_TIMEOUT);
	}

	public OpenAiLlmClient(String baseUrl, String apiKey, String model, Duration connectTimeout, Duration readTimeout) {
		SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
		requestFactory.setConnectTimeout(connectTimeout == null ? DEFAULT_CONNECT_TIMEOUT : connectTimeout);
		requestFactory.setReadTimeout(readTimeout == null ? DEFAULT_READ_TIMEOUT : readTimeout);
		this.restClient = RestClient.builder()
				.baseUrl(baseUrl)
				.requestFactory(requestFactory)
				.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
				.defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
				.build();
		this.model = model;
	}

	@Override
	public LlmSuggestion suggestBudgetNarrative(String context) {
		return complete(BUDGET_SYSTEM_PROMPT, context);
	}

	@Override
	public LlmSuggestion suggestGoalNarrative(String context) {
		return complete(GOAL_SYSTEM_PROMPT, context);
	}

	private LlmSuggestion complete(String systemPrompt, String context) {
		Map<String, Object> request = Map.of("model", model,
				"temperature", 0.2,
				"messages", List.of(
						Map.of("role", "system", "content", systemPrompt),
						Map.of("role", "user", "content", context == null ? "" : context)));
		Map<?, ?> response;
		try {
			response = restClient.post().uri("/chat/completions").body(request).retrieve().body(Map.class);
		} catch (RestClientResponseException ex) {
			throw new LlmRequestException(safeMessage(ex), ex.getStatusCode().value(), isRetryable(ex), ex);
		} catch (ResourceAccessException ex) {
			throw new LlmRequestException(safeMessage(ex), null, true, ex);
		}
		return toSuggestion(response);
	}

	private LlmSuggestion toSuggestion(Map<?, ?> response) {
		if (response == null || response.get("choices") == null) {
			return new LlmSuggestion("", "No response");
		}
		Object choices = response.get("choices");
		if (!(choices instanceof List<?> list) || list.isEmpty()) {
			return new LlmSuggestion("", "No choices");
		}
		Object first = list.get(0);
		if (!(first instanceof Map<?, ?> map)) {
			return new LlmSuggestion("", "Invalid response");
		}
		Object message = map.get("message");
		if (!(message instanceof Map<?, ?> msgMap)) {
			return new LlmSuggestion("", "Invalid message");
		}
		Object content = msgMap.get("content");
		return new LlmSuggestion(content == null ? "" : content.toString(), "openai");
	}

	private boolean isRetryable(RestClientResponseException ex) {
		int status = ex.getStatusCode().value();
		return status == 408 || status == 429 || status >= 500;
	}

	private String safeMessage(Exception ex) {
		String message = ex.getMessage();
		if (message == null || message.isBlank()) {
			message = ex.getClass().getSimpleName();
		}
		return message;
	}
}
