package my.budgetcoach.app.llm;

public interface LlmClient {
	LlmSuggestion suggestBudgetNarrative(String context);

	LlmSuggestion suggestGoalNarrative(String context);
}
