package my.budgetcoach.app.llm;

public record LlmSuggestion(String suggestion, String rationale) {
}
