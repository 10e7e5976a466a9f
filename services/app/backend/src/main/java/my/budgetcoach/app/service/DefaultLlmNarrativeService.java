package my.budgetcoach.app.service;

import my.budgetcoach.app.llm.LlmClient;
import my.budgetcoach.app.llm.LlmRequestException;
import my.budgetcoach.app.llm.LlmSuggestion;
import my.budgetcoach.app.llm.NoopLlmClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.function.Function;

@Service
public class DefaultLlmNarrativeService implements LlmNarrativeService {
	private static final Logger logger = LoggerFactory.getLogger(DefaultLlmNarrativeService.class);
	private final LlmClient llmClient;
	private final boolean enabled;

	public DefaultLlmNarrativeService(LlmClient llmClient) {
		this.llmClient = llmClient;
		this.enabled = llmClient != null && !(llmClient instanceof NoopLlmClient);
	}

	@Override
	public boolean isEnabled() {
		return enabled;
	}

	@Override
	public String suggestBudgetNarrative(String prompt) {
		return request("budget", prompt, context -> llmClient.suggestBudgetNarrative(context));
	}

	@Override
	public String suggestGoalNarrative(String prompt) {
		return request("goal", prompt, context -> llmClient.suggestGoalNarrative(context));
	}

	private String request(String kind, String prompt, Function<String, LlmSuggestion> call) {
		if (!enabled || prompt == null || prompt.isBlank()) {
			return null;
		}
		logger.info("Sending {} narrative request to LLM (promptChars={}).", kind, prompt.length());
		try {
			return narrativeOf(kind, call.apply(prompt));
		} catch (LlmRequestException ex) {
			if (!ex.isRetryable()) {
				logger.warn("LLM {} narrative request rejected ({}, not retrying): {}", kind, ex.statusLabel(), ex.getMessage());
				return null;
			}
			logger.warn("LLM {} narrative request failed ({}), retrying once: {}", kind, ex.statusLabel(), ex.getMessage());
			return retry(kind, prompt, call);
		} catch (RuntimeException ex) {
			logger.warn("LLM {} narrative request failed: {}", kind, ex.getMessage());
			return null;
		}
	}

	private String retry(String kind, String prompt, Function<String, LlmSuggestion> call) {
		try {
			return narrativeOf(kind, call.apply(prompt));
		} catch (LlmRequestException ex) {
			logger.warn("LLM {} narrative retry failed ({}, retryable={}): {}", kind, ex.statusLabel(), ex.isRetryable(), ex.getMessage());
			return null;
		} catch (RuntimeException ex) {
			logger.warn("LLM {} narrative retry failed: {}", kind, ex.getMessage());
			return null;
		}
	}

	private String narrativeOf(String kind, LlmSuggestion suggestion) {
		if (suggestion == null || suggestion.suggestion() == null || suggestion.suggestion().isBlank()) {
			logger.info("LLM returned no {} narrative ({}).", kind, suggestion == null ? "null" : suggestion.rationale());
			return null;
		}
		String narrative = suggestion.suggestion().trim();
		logger.debug("LLM {} narrative: {}", kind, narrative);
		return narrative;
	}
}
