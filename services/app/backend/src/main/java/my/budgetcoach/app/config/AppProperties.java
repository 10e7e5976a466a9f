package my.budgetcoach.app.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.Map;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		Llm llm,
		Finance finance
) {
	public record Llm(
			@NotBlank String provider,
			OpenAi openai
	) {
		public record OpenAi(
				String apiKey,
				String baseUrl,
				String model,
				Integer connectTimeoutSeconds,
				Integer readTimeoutSeconds
		) {
		}
	}

	public record Finance(
			Thresholds thresholds,
			Benchmarks benchmarks
	) {
		public record Thresholds(
				Double lowSavingsRate,
				Double concentrationShare,
				Double emergencyFundMonths
		) {
		}

		public record Benchmarks(
				Double targetSavingsRate,
				Map<String, Double> categoryCeilings
		) {
		}
	}
}
