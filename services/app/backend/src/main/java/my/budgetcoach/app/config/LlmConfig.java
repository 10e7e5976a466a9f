package my.budgetcoach.app.config;

import my.budgetcoach.app.llm.LlmClient;
import my.budgetcoach.app.llm.NoopLlmClient;
import my.budgetcoach.app.llm.OpenAiLlmClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class LlmConfig {
	private static final Logger logger = LoggerFactory.getLogger(LlmConfig.class);
	private static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";
	private static final String DEFAULT_MODEL = "gpt-4o-mini";

	@Bean
	@ConditionalOnProperty(name = "app.llm.provider", havingValue = "openai")
	public LlmClient openAiLlmClient(AppProperties properties) {
		AppProperties.Llm.OpenAi openai = properties.llm() == null ? null : properties.llm().openai();
		if (openai == null || openai.apiKey() == null || openai.apiKey().isBlank()) {
			logger.warn("LLM provider openai selected without an API key; narratives fall back to templates.");
			return new NoopLlmClient();
		}
		String baseUrl = openai.baseUrl() == null || openai.baseUrl().isBlank() ? DEFAULT_BASE_URL : openai.baseUrl();
		String model = openai.model() == null || openai.model().isBlank() ? DEFAULT_MODEL : openai.model();
		Duration connectTimeout = openai.connectTimeoutSeconds() == null ? null
				: Duration.ofSeconds(Math.max(1, openai.connectTimeoutSeconds()));
		Duration readTimeout = openai.readTimeoutSeconds() == null ? null
				: Duration.ofSeconds(Math.max(1, openai.readTimeoutSeconds()));
		logger.info("LLM client enabled (provider=openai, model={}).", model);
		return new OpenAiLlmClient(baseUrl, openai.apiKey(), model, connectTimeout, readTimeout);
	}

	@Bean
	@ConditionalOnMissingBean(LlmClient.class)
	public NoopLlmClient noopLlmClient() {
		logger.info("LLM client disabled (provider=noop).");
		return new NoopLlmClient();
	}
}
