package my.budgetcoach.app.service;

import my.budgetcoach.app.llm.LlmClient;
import my.budgetcoach.app.llm.LlmRequestException;
import my.budgetcoach.app.llm.LlmSuggestion;
import my.budgetcoach.app.llm.NoopLlmClient;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DefaultLlmNarrativeServiceTest {
	@Mock
	private LlmClient llmClient;

	@Test
	void noopClientDisablesNarratives() {
		DefaultLlmNarrativeService service = new DefaultLlmNarrativeService(new NoopLlmClient());

		assertThat(service.isEnabled()).isFalse();
		assertThat(service.suggestBudgetNarrative("prompt")).isNull();
	}

	@Test
	void returnsTrimmedSuggestion() {
		when(llmClient.suggestBudgetNarrative("prompt")).thenReturn(new LlmSuggestion("  Looks solid.  ", "openai"));
		DefaultLlmNarrativeService service = new DefaultLlmNarrativeService(llmClient);

		assertThat(service.isEnabled()).isTrue();
		assertThat(service.suggestBudgetNarrative("prompt")).isEqualTo("Looks solid.");
	}

	@Test
	void blankSuggestionBecomesNull() {
		when(llmClient.suggestGoalNarrative("prompt")).thenReturn(new LlmSuggestion(" ", "No choices"));
		DefaultLlmNarrativeService service = new DefaultLlmNarrativeService(llmClient);

		assertThat(service.suggestGoalNarrative("prompt")).isNull();
	}

	@Test
	void clientFailureBecomesNull() {
		when(llmClient.suggestGoalNarrative("prompt"))
				.thenThrow(new LlmRequestException("boom", 503, true, null));
		DefaultLlmNarrativeService service = new DefaultLlmNarrativeService(llmClient);

		assertThat(service.suggestGoalNarrative("prompt")).isNull();
	}

	@Test
	void blankPromptSkipsClient() {
		DefaultLlmNarrativeService service = new DefaultLlmNarrativeService(llmClient);

		assertThat(service.suggestBudgetNarrative(" ")).isNull();
		verifyNoInteractions(llmClient);
	}

	@Test
	void retryableFailureIsRetriedOnce() {
		when(llmClient.suggestBudgetNarrative("prompt"))
				.thenThrow(new LlmRequestException("timeout", null, true, null))
				.thenReturn(new LlmSuggestion("Second try.", "openai"));
		DefaultLlmNarrativeService service = new DefaultLlmNarrativeService(llmClient);

		assertThat(service.suggestBudgetNarrative("prompt")).isEqualTo("Second try.");
		verify(llmClient, times(2)).suggestBudgetNarrative("prompt");
	}

	@Test
	void nonRetryableFailureIsNotRetried() {
		when(llmClient.suggestGoalNarrative("prompt"))
				.thenThrow(new LlmRequestException("bad key", 401, false, null));
		DefaultLlmNarrativeService service = new DefaultLlmNarrativeService(llmClient);

		assertThat(service.suggestGoalNarrative("prompt")).isNull();
		verify(llmClient, times(1)).suggestGoalNarrative("prompt");
	}

	@Test
	void retryableFailureGivesUpAfterSecondAttempt() {
		when(llmClient.suggestGoalNarrative("prompt"))
				.thenThrow(new LlmRequestException("unavailable", 503, true, null));
		DefaultLlmNarrativeService service = new DefaultLlmNarrativeService(llmClient);

		assertThat(service.suggestGoalNarrative("prompt")).isNull();
		verify(llmClient, times(2)).suggestGoalNarrative("prompt");
	}
}
