package my.budgetcoach.app.llm;

public class NoopLlmClient implements LlmClient {
	@Override
	public LlmSuggestion suggestBudgetNarrative(String context) {
		return new LlmSuggestion("", "LLM disabled");
	}

	@Override
	public LlmSuggestion suggestGoalNarrative(String context) {
		return new LlmSuggestion("", "LLM disabled");
	}
}
