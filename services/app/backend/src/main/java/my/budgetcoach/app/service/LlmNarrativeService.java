package my.budgetcoach.app.service;

public interface LlmNarrativeService {
	boolean isEnabled();

	String suggestBudgetNarrative(String prompt);

	String suggestGoalNarrative(String prompt);
}
